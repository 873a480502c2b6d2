package com.flagship.ledger_invoicing.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Optional criteria for listing transactions; null fields are ignored.
 * {@code from} is inclusive, {@code to} exclusive.
 */
@Value
public class TransactionFilter {
    Instant from;
    Instant to;
    UUID periodId;
    Transaction.Direction direction;

    public static TransactionFilter none() {
        return new TransactionFilter(null, null, null, null);
    }
}
