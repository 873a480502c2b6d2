package com.flagship.ledger_invoicing.catalog;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Sellable product or service. Its tax flag decides whether invoice lines
 * referencing it carry tax.
 */
@Value
public class Product {
    UUID id;
    String code;
    String name;
    BigDecimal unitPrice;
    boolean taxApplicable;
    boolean active;
    Instant createdAt;
}
