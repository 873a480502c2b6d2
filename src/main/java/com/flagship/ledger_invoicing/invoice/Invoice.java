package com.flagship.ledger_invoicing.invoice;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Invoice header with its current lines.
 *
 * {@code subtotal}, {@code tax} and {@code grandTotal} are always the sums of
 * the lines' subtotal, tax and total. {@code discount} is a separate header
 * value set by the caller and is not part of the grand total.
 */
@Value
public class Invoice {
    UUID id;
    String invoiceNumber;
    UUID clientId;
    UUID transactionId;
    BigDecimal subtotal;
    BigDecimal discount;
    BigDecimal tax;
    BigDecimal grandTotal;
    String paymentTerms;
    String salesperson;
    Instant issuedAt;
    Instant dueAt;
    String notes;
    Long version;
    Instant createdAt;
    Instant updatedAt;
    List<InvoiceLine> lines;
}
