package com.flagship.ledger_invoicing.invoice;

import com.flagship.ledger_invoicing.exception.ConstraintViolationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;

import static org.junit.jupiter.api.Assertions.*;

class InvoiceLineCalculatorTest {

    private final InvoiceLineCalculator calculator = new InvoiceLineCalculator(new BigDecimal("0.13"));

    @Test
    @DisplayName("Percentage discount then tax: 5 x 10.00 at 10% off")
    void testPercentageDiscountAndTax() {
        // Given: quantity 5, unit price 10.00, 10% discount, taxable product
        // When
        LineAggregate line = calculator.computeLine(
            new BigDecimal("5"), new BigDecimal("10.00"), new BigDecimal("10"), null, true);

        // Then: 50.00 - 5.00 = 45.00, tax 5.85, total 50.85
        assertEquals(0, line.getDiscountAmount().compareTo(new BigDecimal("5.00")));
        assertEquals(0, line.getLineSubtotal().compareTo(new BigDecimal("45.00")));
        assertEquals(0, line.getLineTax().compareTo(new BigDecimal("5.85")));
        assertEquals(0, line.getLineTotal().compareTo(new BigDecimal("50.85")));
    }

    @Test
    @DisplayName("Repeated calls with the same inputs give the same line")
    void testDeterministic() {
        for (int i = 0; i < 3; i++) {
            LineAggregate line = calculator.computeLine(
                new BigDecimal("2"), new BigDecimal("25.00"), new BigDecimal("10"), null, true);

            assertEquals(0, line.getLineSubtotal().compareTo(new BigDecimal("45.00")));
            assertEquals(0, line.getLineTax().compareTo(new BigDecimal("5.85")));
            assertEquals(0, line.getLineTotal().compareTo(new BigDecimal("50.85")));
        }
    }

    @Test
    @DisplayName("A positive percentage overrides the discount amount")
    void testPercentageOverridesAmount() {
        LineAggregate line = calculator.computeLine(
            new BigDecimal("2"), new BigDecimal("50.00"), new BigDecimal("20"), new BigDecimal("1.00"), true);

        assertEquals(0, line.getDiscountAmount().compareTo(new BigDecimal("20.00")));
        assertEquals(0, line.getLineSubtotal().compareTo(new BigDecimal("80.00")));
    }

    @Test
    @DisplayName("Discount amount applies when the percentage is absent or zero")
    void testDiscountAmountApplies() {
        LineAggregate line = calculator.computeLine(
            new BigDecimal("1"), new BigDecimal("100.00"), BigDecimal.ZERO, new BigDecimal("15.00"), true);

        assertEquals(0, line.getLineSubtotal().compareTo(new BigDecimal("85.00")));
        assertEquals(0, line.getLineTax().compareTo(new BigDecimal("11.05")));
        assertEquals(0, line.getLineTotal().compareTo(new BigDecimal("96.05")));
    }

    @Test
    @DisplayName("Untaxed products get zero tax")
    void testUntaxedProduct() {
        LineAggregate line = calculator.computeLine(
            new BigDecimal("3"), new BigDecimal("7.50"), null, null, false);

        assertEquals(0, line.getLineSubtotal().compareTo(new BigDecimal("22.50")));
        assertEquals(0, line.getLineTax().compareTo(BigDecimal.ZERO));
        assertEquals(0, line.getLineTotal().compareTo(new BigDecimal("22.50")));
    }

    @Test
    @DisplayName("Tax rounds half up to the cent")
    void testTaxRounding() {
        // 0.13 x 0.50 = 0.065 -> 0.07
        LineAggregate line = calculator.computeLine(
            BigDecimal.ONE, new BigDecimal("0.50"), null, null, true);

        assertEquals(0, line.getLineTax().compareTo(new BigDecimal("0.07")));
        assertEquals(0, line.getLineTotal().compareTo(new BigDecimal("0.57")));
    }

    @Test
    @DisplayName("Subtotal plus tax always equals total")
    void testTotalIsSubtotalPlusTax() {
        LineAggregate line = calculator.computeLine(
            new BigDecimal("7"), new BigDecimal("13.33"), new BigDecimal("12.5"), null, true);

        assertEquals(0, line.getLineSubtotal().add(line.getLineTax()).compareTo(line.getLineTotal()));
    }

    @Test
    @DisplayName("A discount larger than the line amount is rejected")
    void testNegativeSubtotal_Rejected() {
        ConstraintViolationException exception = assertThrows(
            ConstraintViolationException.class,
            () -> calculator.computeLine(BigDecimal.ONE, new BigDecimal("10.00"), null, new BigDecimal("10.01"), true)
        );
        assertTrue(exception.getMessage().contains("exceeds"));
    }

    @Test
    @DisplayName("Invalid inputs are rejected")
    void testInvalidInputs_Rejected() {
        assertThrows(ConstraintViolationException.class,
            () -> calculator.computeLine(BigDecimal.ZERO, new BigDecimal("1.00"), null, null, true));
        assertThrows(ConstraintViolationException.class,
            () -> calculator.computeLine(null, new BigDecimal("1.00"), null, null, true));
        assertThrows(ConstraintViolationException.class,
            () -> calculator.computeLine(BigDecimal.ONE, new BigDecimal("-1.00"), null, null, true));
        assertThrows(ConstraintViolationException.class,
            () -> calculator.computeLine(BigDecimal.ONE, new BigDecimal("1.00"), new BigDecimal("100.01"), null, true));
        assertThrows(ConstraintViolationException.class,
            () -> calculator.computeLine(BigDecimal.ONE, new BigDecimal("1.00"), new BigDecimal("-1"), null, true));
        assertThrows(ConstraintViolationException.class,
            () -> calculator.computeLine(BigDecimal.ONE, new BigDecimal("1.00"), null, new BigDecimal("-0.01"), true));
    }

    @Test
    @DisplayName("Inputs with more than two decimals are rejected instead of rounded on storage")
    void testSubCentInputs_Rejected() {
        ConstraintViolationException exception = assertThrows(
            ConstraintViolationException.class,
            () -> calculator.computeLine(new BigDecimal("1.005"), new BigDecimal("10.00"), null, null, false)
        );
        assertTrue(exception.getMessage().contains("quantity"));

        assertThrows(ConstraintViolationException.class,
            () -> calculator.computeLine(BigDecimal.ONE, new BigDecimal("10.001"), null, null, false));
        assertThrows(ConstraintViolationException.class,
            () -> calculator.computeLine(BigDecimal.ONE, new BigDecimal("10.00"), new BigDecimal("12.345"), null, false));
        assertThrows(ConstraintViolationException.class,
            () -> calculator.computeLine(BigDecimal.ONE, new BigDecimal("10.00"), null, new BigDecimal("0.005"), false));
    }

    @Test
    @DisplayName("The returned inputs reproduce the subtotal at storage scale")
    void testStoredInputsReproduceSubtotal() {
        // Given: trailing zeros beyond two decimals are harmless
        LineAggregate line = calculator.computeLine(
            new BigDecimal("1.2500"), new BigDecimal("3.330"), null, new BigDecimal("0.10"), true);

        // Then: what gets stored recomputes to the stored subtotal
        assertEquals(2, line.getQuantity().scale());
        assertEquals(2, line.getUnitPrice().scale());
        BigDecimal recomputed = line.getQuantity().multiply(line.getUnitPrice())
            .setScale(2, RoundingMode.HALF_UP)
            .subtract(line.getDiscountAmount());
        assertEquals(0, recomputed.compareTo(line.getLineSubtotal()));
        assertEquals(0, line.getLineSubtotal().compareTo(new BigDecimal("4.06")));
    }

    @Test
    @DisplayName("Inputs and results beyond the line columns are rejected")
    void testOutOfRange_Rejected() {
        // Inputs
        assertThrows(ConstraintViolationException.class,
            () -> calculator.computeLine(new BigDecimal("10000000000"), BigDecimal.ONE, null, null, false));
        assertThrows(ConstraintViolationException.class,
            () -> calculator.computeLine(BigDecimal.ONE, new BigDecimal("10000000000.00"), null, null, false));

        // Raw amount: 100000 x 100000.00
        ConstraintViolationException exception = assertThrows(
            ConstraintViolationException.class,
            () -> calculator.computeLine(new BigDecimal("100000"), new BigDecimal("100000.00"), null, null, false)
        );
        assertTrue(exception.getMessage().contains("out of range"));

        // Tax pushes the total over the limit
        assertThrows(ConstraintViolationException.class,
            () -> calculator.computeLine(BigDecimal.ONE, new BigDecimal("9999999999.00"), null, null, true));
        assertDoesNotThrow(
            () -> calculator.computeLine(BigDecimal.ONE, new BigDecimal("9999999999.00"), null, null, false));
    }

    @Test
    @DisplayName("A negative tax rate cannot be configured")
    void testNegativeTaxRate_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> new InvoiceLineCalculator(new BigDecimal("-0.01")));
    }
}
