package com.phoenixdash.gateway.recurring;

public class ContactNotFoundException extends RuntimeException {

    private final String contactId;

    public ContactNotFoundException(String contactId) {
        super("Contact not found");
        this.contactId = contactId;
    }

    public String getContactId() {
        return contactId;
    }
}
