package com.flagship.ledger_invoicing.invoice;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Inputs of an invoice line. A null unit price means the product's price.
 */
@Value
public class LineRequest {
    UUID productId;
    String description;
    BigDecimal quantity;
    BigDecimal unitPrice;
    BigDecimal discountPercentage;
    BigDecimal discountAmount;
}
