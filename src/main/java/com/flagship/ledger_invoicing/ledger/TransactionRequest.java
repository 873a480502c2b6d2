package com.flagship.ledger_invoicing.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Header fields of a transaction, used for both creation and update.
 * Entries are added separately through {@link LedgerService}.
 */
@Value
public class TransactionRequest {
    String description;
    Instant occurredAt;
    Transaction.Direction direction;
    CurrencyCode currency;
    String createdBy;
    UUID periodId;
}
