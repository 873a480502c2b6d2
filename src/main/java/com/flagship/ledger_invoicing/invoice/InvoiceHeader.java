package com.flagship.ledger_invoicing.invoice;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Caller-settable invoice fields. Totals are deliberately absent.
 */
@Value
public class InvoiceHeader {
    UUID clientId;
    UUID transactionId;
    BigDecimal discount;
    String paymentTerms;
    String salesperson;
    Instant issuedAt;
    Instant dueAt;
    String notes;
}
