package com.flagship.ledger_invoicing.invoice;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class InvoiceLine {
    UUID id;
    UUID invoiceId;
    UUID productId;
    String description;
    BigDecimal quantity;
    BigDecimal unitPrice;
    BigDecimal discountPercentage;
    BigDecimal discountAmount;
    BigDecimal lineSubtotal;
    BigDecimal lineTax;
    BigDecimal lineTotal;
    Instant createdAt;
}
