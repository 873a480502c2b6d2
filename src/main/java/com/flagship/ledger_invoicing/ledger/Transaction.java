package com.flagship.ledger_invoicing.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Transaction header. Owns its ledger entries, which are written one at a
 * time after the header exists.
 */
@Value
public class Transaction {
    UUID id;
    Instant occurredAt;
    String description;
    Direction direction;
    CurrencyCode currency;
    String createdBy;
    UUID periodId;
    Instant createdAt;

    public enum Direction {
        INCOME,
        EXPENSE
    }
}
