package com.flagship.ledger_invoicing.invoice;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Aggregates over the stored invoice totals of an issue date range.
 * {@code averageTotal} is the mean grand total, zero when there are no invoices.
 */
@Value
public class InvoiceStatistics {
    long invoiceCount;
    BigDecimal subtotal;
    BigDecimal tax;
    BigDecimal discount;
    BigDecimal grandTotal;
    BigDecimal averageTotal;
}
