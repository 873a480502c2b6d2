package com.flagship.ledger_invoicing.invoice;

import com.flagship.ledger_invoicing.common.Money;
import com.flagship.ledger_invoicing.exception.ConstraintViolationException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Derives a line's subtotal, tax and total from its inputs.
 *
 * Steps, in order:
 * 1. raw = quantity x unit price
 * 2. a positive discount percentage yields raw x pct / 100 and overrides any
 *    supplied discount amount; otherwise the supplied amount applies
 * 3. subtotal = raw - discount, which must not be negative
 * 4. tax = subtotal x tax rate for taxable products, else zero
 * 5. total = subtotal + tax
 *
 * Inputs must already be at storage scale (two decimals) so the stored line
 * reproduces its own subtotal; every input and result must fit the line columns.
 *
 * Pure and deterministic: the same inputs always give the same aggregate, so
 * it is safe to re-run on every line update.
 */
@Component
public class InvoiceLineCalculator {

    private final BigDecimal taxRate;

    public InvoiceLineCalculator(@Value("${invoicing.tax-rate:0.13}") BigDecimal taxRate) {
        if (taxRate == null || taxRate.signum() < 0) {
            throw new IllegalArgumentException("Tax rate must be zero or positive: " + taxRate);
        }
        this.taxRate = taxRate;
    }

    public BigDecimal getTaxRate() {
        return taxRate;
    }

    /**
     * @param discountPercentage optional, 0 to 100
     * @param discountAmount optional, zero or positive; ignored when a positive percentage is given
     * @throws ConstraintViolationException on invalid inputs, a negative subtotal or an out of range result
     */
    public LineAggregate computeLine(BigDecimal quantity,
                                     BigDecimal unitPrice,
                                     BigDecimal discountPercentage,
                                     BigDecimal discountAmount,
                                     boolean taxApplicable) {
        if (quantity == null || quantity.signum() <= 0) {
            throw new ConstraintViolationException("Line quantity must be greater than zero: " + quantity);
        }
        if (unitPrice == null || unitPrice.signum() < 0) {
            throw new ConstraintViolationException("Line unit price must be zero or positive: " + unitPrice);
        }
        if (discountPercentage != null
                && (discountPercentage.signum() < 0 || discountPercentage.compareTo(Money.ONE_HUNDRED) > 0)) {
            throw new ConstraintViolationException(
                "Line discount percentage must be between 0 and 100: " + discountPercentage);
        }
        if (Money.isNegative(discountAmount)) {
            throw new ConstraintViolationException("Line discount amount must be zero or positive: " + discountAmount);
        }
        requireStorageScale("quantity", quantity);
        requireStorageScale("unit price", unitPrice);
        requireStorageScale("discount percentage", discountPercentage);
        requireStorageScale("discount amount", discountAmount);
        requireLineRange("quantity", quantity);
        requireLineRange("unit price", unitPrice);
        requireLineRange("discount amount", discountAmount);

        BigDecimal raw = Money.normalize(quantity.multiply(unitPrice));
        requireLineRange("amount", raw);

        BigDecimal discount;
        if (Money.isPositive(discountPercentage)) {
            discount = Money.normalize(raw.multiply(discountPercentage).divide(Money.ONE_HUNDRED));
        } else {
            discount = Money.normalize(discountAmount);
        }

        BigDecimal subtotal = raw.subtract(discount);
        if (subtotal.signum() < 0) {
            throw new ConstraintViolationException(
                String.format("Line discount %s exceeds line amount %s", discount, raw));
        }

        BigDecimal tax = taxApplicable ? Money.normalize(subtotal.multiply(taxRate)) : Money.ZERO;
        BigDecimal total = subtotal.add(tax);
        requireLineRange("total", total);

        return new LineAggregate(
            Money.normalize(quantity),
            Money.normalize(unitPrice),
            discountPercentage == null ? null : Money.normalize(discountPercentage),
            discount,
            subtotal,
            tax,
            total
        );
    }

    private static void requireStorageScale(String field, BigDecimal value) {
        if (!Money.hasStorageScale(value)) {
            throw new ConstraintViolationException(
                String.format("Line %s allows at most %d decimals: %s", field, Money.SCALE, value));
        }
    }

    private static void requireLineRange(String field, BigDecimal value) {
        if (!Money.fitsIntegerDigits(value, Money.LINE_INTEGER_DIGITS)) {
            throw new ConstraintViolationException(String.format("Line %s out of range: %s", field, value));
        }
    }
}
