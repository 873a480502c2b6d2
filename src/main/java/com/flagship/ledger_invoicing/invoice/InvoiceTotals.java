package com.flagship.ledger_invoicing.invoice;

import com.flagship.ledger_invoicing.common.Money;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Header totals summed from an invoice's lines. Can only be built from lines,
 * which is what makes {@link InvoiceEntity#applyTotals(InvoiceTotals)} safe.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InvoiceTotals {
    BigDecimal subtotal;
    BigDecimal tax;
    BigDecimal grandTotal;

    static InvoiceTotals of(List<InvoiceLineEntity> lines) {
        BigDecimal subtotal = Money.ZERO;
        BigDecimal tax = Money.ZERO;
        BigDecimal total = Money.ZERO;
        for (InvoiceLineEntity line : lines) {
            subtotal = subtotal.add(line.getLineSubtotal());
            tax = tax.add(line.getLineTax());
            total = total.add(line.getLineTotal());
        }
        return new InvoiceTotals(Money.normalize(subtotal), Money.normalize(tax), Money.normalize(total));
    }
}
