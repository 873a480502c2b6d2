package com.flagship.ledger_invoicing.ledger;

import com.flagship.ledger_invoicing.common.Money;
import com.flagship.ledger_invoicing.exception.ConstraintViolationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Structural check for a single ledger entry, independent of every other
 * entry of the transaction. Balance across entries is not checked here; see
 * {@link LedgerService#computeBalance}.
 */
@Component
public class LedgerEntryValidator {

    /**
     * Rejects the amounts unless exactly one side is positive and the other is
     * exactly zero. Amounts are checked as given: sub-cent precision and values
     * beyond the column range are rejected rather than rounded.
     *
     * @throws ConstraintViolationException if either side is negative, has more than two decimals,
     *         exceeds the storable range, both are zero or both are positive
     */
    public void validate(BigDecimal debit, BigDecimal credit) {
        if (Money.isNegative(debit) || Money.isNegative(credit)) {
            throw new ConstraintViolationException(
                String.format("Ledger entry amounts must not be negative: debit=%s, credit=%s", debit, credit));
        }
        if (!Money.hasStorageScale(debit) || !Money.hasStorageScale(credit)) {
            throw new ConstraintViolationException(
                String.format("Ledger entry amounts allow at most %d decimals: debit=%s, credit=%s",
                    Money.SCALE, debit, credit));
        }
        if (!Money.fitsIntegerDigits(debit, Money.AMOUNT_INTEGER_DIGITS)
                || !Money.fitsIntegerDigits(credit, Money.AMOUNT_INTEGER_DIGITS)) {
            throw new ConstraintViolationException(
                String.format("Ledger entry amount out of range: debit=%s, credit=%s", debit, credit));
        }
        if (Money.isZero(debit) && Money.isZero(credit)) {
            throw new ConstraintViolationException(
                "Ledger entry must carry either a debit or a credit, both are zero");
        }
        if (Money.isPositive(debit) && Money.isPositive(credit)) {
            throw new ConstraintViolationException(
                String.format("Ledger entry cannot be both debit and credit: debit=%s, credit=%s", debit, credit));
        }
    }
}
