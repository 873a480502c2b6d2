package com.flagship.ledger_invoicing.exception;

/**
 * A concurrent writer got there first (stale version, lock not acquired,
 * duplicate generated number). The caller must retry the whole operation;
 * nothing was persisted.
 */
public class ConcurrencyConflictException extends IllegalStateException {

    public ConcurrencyConflictException(String message) {
        super(message);
    }

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
