package com.phoenixdash.gateway.recurring;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Contacts and their payment addresses.
 */
@Slf4j
public class ContactService {

    private final ExecutionLedger ledger;

    public ContactService(ExecutionLedger ledger) {
        this.ledger = ledger;
    }

    public List<Contact> list() {
        return ledger.listContacts();
    }

    public Contact get(String id) {
        return ledger.findContact(id).orElseThrow(() -> new ContactNotFoundException(id));
    }

    /**
     * Store a new contact. Address ids are generated when absent.
     */
    public Contact create(Contact contact) {
        if (contact.getName() == null || contact.getName().isBlank()) {
            throw new RecurringPaymentValidationException("Name is required");
        }
        List<ContactAddress> addresses = contact.getAddresses() != null ? contact.getAddresses() : new ArrayList<>();
        for (ContactAddress address : addresses) {
            if (address.getAddress() == null || address.getAddress().isBlank()) {
                throw new RecurringPaymentValidationException("Address is required");
            }
            if (address.getType() == null) {
                throw new RecurringPaymentValidationException("Invalid address type");
            }
        }
        Contact toSave = Contact.builder()
                .name(contact.getName().trim())
                .addresses(addresses)
                .build();
        Contact saved = ledger.saveContact(toSave);
        log.info("Created contact {} with {} address(es)", saved.getId(), saved.getAddresses().size());
        return saved;
    }
}
