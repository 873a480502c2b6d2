package com.flagship.ledger_invoicing.exception;

/**
 * A write was rejected before touching the store because it would break a
 * data invariant: debit/credit exclusivity of a ledger entry, a negative
 * invoice line subtotal, an inverted period, or a reference to an inactive
 * product or client.
 *
 * The message is meant to be shown verbatim to the caller.
 */
public class ConstraintViolationException extends IllegalArgumentException {

    public ConstraintViolationException(String message) {
        super(message);
    }
}
