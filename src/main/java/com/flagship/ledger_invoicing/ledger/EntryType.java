package com.flagship.ledger_invoicing.ledger;

/**
 * Side of a ledger entry. Each entry is exactly one of the two.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
