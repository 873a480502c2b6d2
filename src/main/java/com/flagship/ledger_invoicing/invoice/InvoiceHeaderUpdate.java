package com.flagship.ledger_invoicing.invoice;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Partial header update: null fields keep their current value. When
 * {@code expectedVersion} is set the update only applies to that version.
 */
@Value
public class InvoiceHeaderUpdate {
    UUID clientId;
    UUID transactionId;
    BigDecimal discount;
    String paymentTerms;
    String salesperson;
    Instant dueAt;
    String notes;
    Long expectedVersion;
}
