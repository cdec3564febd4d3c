package com.phoenixdash.app.recurring;

import com.phoenixdash.gateway.recurring.Contact;
import com.phoenixdash.gateway.recurring.ContactService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/contacts")
public class ContactController {

    private final ContactService contacts;

    public ContactController(ContactService contacts) {
        this.contacts = contacts;
    }

    @GetMapping
    public List<Contact> list() {
        return contacts.list();
    }

    @GetMapping("/{id}")
    public Contact get(@PathVariable String id) {
        return contacts.get(id);
    }

    @PostMapping
    public ResponseEntity<Contact> create(@RequestBody Contact contact) {
        return ResponseEntity.status(HttpStatus.CREATED).body(contacts.create(contact));
    }
}
