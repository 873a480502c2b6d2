package com.flagship.ledger_invoicing.exception;

/**
 * A referenced row (account, period, transaction, entry, invoice, line,
 * product or client) does not exist.
 */
public class NotFoundException extends RuntimeException {

    private final String resourceType;
    private final Object resourceId;

    public NotFoundException(String resourceType, Object resourceId) {
        super(resourceType + " not found: " + resourceId);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public Object getResourceId() {
        return resourceId;
    }
}
