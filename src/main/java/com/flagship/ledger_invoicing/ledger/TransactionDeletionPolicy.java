package com.flagship.ledger_invoicing.ledger;

/**
 * What happens to a transaction's entries when the transaction is deleted.
 */
public enum TransactionDeletionPolicy {
    /** Refuse the delete while any entry references the transaction. */
    REJECT_IF_ENTRIES,
    /** Delete the entries first, then the header, in one unit of work. */
    CASCADE
}
