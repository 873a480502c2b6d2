package com.flagship.ledger_invoicing.exception;

/**
 * Delete rejected because other rows still reference the target.
 */
public class ReferentialIntegrityException extends IllegalStateException {

    public ReferentialIntegrityException(String message) {
        super(message);
    }

    public ReferentialIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
