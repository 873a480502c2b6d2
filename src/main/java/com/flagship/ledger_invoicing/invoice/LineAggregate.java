package com.flagship.ledger_invoicing.invoice;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Inputs and derived amounts of one invoice line, as produced by
 * {@link InvoiceLineCalculator}. {@code discountAmount} is the discount that
 * was actually applied.
 */
@Value
public class LineAggregate {
    BigDecimal quantity;
    BigDecimal unitPrice;
    BigDecimal discountPercentage;
    BigDecimal discountAmount;
    BigDecimal lineSubtotal;
    BigDecimal lineTax;
    BigDecimal lineTotal;
}
