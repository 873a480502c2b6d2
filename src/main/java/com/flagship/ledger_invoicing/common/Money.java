package com.flagship.ledger_invoicing.common;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Monetary arithmetic shared by the ledger and invoicing code.
 * All stored amounts carry two decimals and round half-up.
 */
public final class Money {

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, ROUNDING);
    public static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

    /** Integer digits of a NUMERIC(15, 2) column: ledger amounts and invoice totals. */
    public static final int AMOUNT_INTEGER_DIGITS = 13;
    /** Integer digits of a NUMERIC(12, 2) column: invoice line inputs and results. */
    public static final int LINE_INTEGER_DIGITS = 10;

    private Money() {
        // Utility class
    }

    /**
     * Brings an amount to storage scale; null is read as zero.
     */
    public static BigDecimal normalize(BigDecimal amount) {
        return amount == null ? ZERO : amount.setScale(SCALE, ROUNDING);
    }

    /**
     * True when the amount is stored without rounding: at most two decimals
     * once trailing zeros are dropped. Null passes.
     */
    public static boolean hasStorageScale(BigDecimal amount) {
        return amount == null || amount.stripTrailingZeros().scale() <= SCALE;
    }

    /**
     * True when the amount's integer part fits the given number of digits. Null passes.
     */
    public static boolean fitsIntegerDigits(BigDecimal amount, int integerDigits) {
        return amount == null || amount.abs().compareTo(BigDecimal.TEN.pow(integerDigits)) < 0;
    }

    public static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.signum() > 0;
    }

    public static boolean isNegative(BigDecimal amount) {
        return amount != null && amount.signum() < 0;
    }

    public static boolean isZero(BigDecimal amount) {
        return amount == null || amount.signum() == 0;
    }

    /**
     * Decimal equality ignoring scale (100.0 equals 100.00).
     */
    public static boolean sameAmount(BigDecimal a, BigDecimal b) {
        return normalize(a).compareTo(normalize(b)) == 0;
    }
}
