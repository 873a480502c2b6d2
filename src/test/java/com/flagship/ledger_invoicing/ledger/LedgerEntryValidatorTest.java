package com.flagship.ledger_invoicing.ledger;

import com.flagship.ledger_invoicing.exception.ConstraintViolationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Structural rules for a single entry: exactly one side positive, the other zero.
 */
class LedgerEntryValidatorTest {

    private final LedgerEntryValidator validator = new LedgerEntryValidator();

    @Test
    @DisplayName("Debit-only and credit-only entries are accepted")
    void testSingleSidedEntries_Accepted() {
        assertDoesNotThrow(() -> validator.validate(new BigDecimal("100.00"), BigDecimal.ZERO));
        assertDoesNotThrow(() -> validator.validate(BigDecimal.ZERO, new BigDecimal("0.01")));
    }

    @Test
    @DisplayName("Null amounts count as zero")
    void testNullAmounts_TreatedAsZero() {
        assertDoesNotThrow(() -> validator.validate(new BigDecimal("25.50"), null));
        assertDoesNotThrow(() -> validator.validate(null, new BigDecimal("25.50")));
        assertThrows(ConstraintViolationException.class, () -> validator.validate(null, null));
    }

    @Test
    @DisplayName("Both sides zero is rejected")
    void testBothZero_Rejected() {
        ConstraintViolationException exception = assertThrows(
            ConstraintViolationException.class,
            () -> validator.validate(BigDecimal.ZERO, new BigDecimal("0.00"))
        );
        assertTrue(exception.getMessage().contains("both are zero"));
    }

    @Test
    @DisplayName("Both sides positive is rejected")
    void testBothPositive_Rejected() {
        ConstraintViolationException exception = assertThrows(
            ConstraintViolationException.class,
            () -> validator.validate(new BigDecimal("10.00"), new BigDecimal("10.00"))
        );
        assertTrue(exception.getMessage().contains("both debit and credit"));
    }

    @Test
    @DisplayName("Negative amounts are rejected on either side")
    void testNegativeAmounts_Rejected() {
        assertThrows(ConstraintViolationException.class,
            () -> validator.validate(new BigDecimal("-1.00"), BigDecimal.ZERO));
        assertThrows(ConstraintViolationException.class,
            () -> validator.validate(BigDecimal.ZERO, new BigDecimal("-0.01")));
        assertThrows(ConstraintViolationException.class,
            () -> validator.validate(new BigDecimal("-5.00"), new BigDecimal("5.00")));
    }

    @Test
    @DisplayName("Negative sub-cent amounts are rejected, not rounded to zero")
    void testNegativeSubCentAmount_Rejected() {
        ConstraintViolationException exception = assertThrows(
            ConstraintViolationException.class,
            () -> validator.validate(new BigDecimal("-0.001"), new BigDecimal("5.00"))
        );
        assertTrue(exception.getMessage().contains("must not be negative"));
    }

    @Test
    @DisplayName("A sub-cent amount on the other side is not treated as zero")
    void testSubCentOtherSide_Rejected() {
        assertThrows(ConstraintViolationException.class,
            () -> validator.validate(new BigDecimal("0.004"), new BigDecimal("5.00")));
        assertThrows(ConstraintViolationException.class,
            () -> validator.validate(new BigDecimal("0.001"), BigDecimal.ZERO));
    }

    @Test
    @DisplayName("Trailing zeros beyond two decimals are accepted")
    void testTrailingZeros_Accepted() {
        assertDoesNotThrow(() -> validator.validate(new BigDecimal("12.5000"), new BigDecimal("0.000")));
    }

    @Test
    @DisplayName("Amounts beyond the storable range are rejected")
    void testOutOfRangeAmount_Rejected() {
        assertDoesNotThrow(() -> validator.validate(new BigDecimal("9999999999999.99"), BigDecimal.ZERO));
        ConstraintViolationException exception = assertThrows(
            ConstraintViolationException.class,
            () -> validator.validate(new BigDecimal("10000000000000.00"), BigDecimal.ZERO)
        );
        assertTrue(exception.getMessage().contains("out of range"));
    }
}
