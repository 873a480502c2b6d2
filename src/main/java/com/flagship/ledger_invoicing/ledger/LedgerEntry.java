package com.flagship.ledger_invoicing.ledger;

import com.flagship.ledger_invoicing.common.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A single debit or credit line of a transaction.
 *
 * Exactly one of {@code debit} and {@code credit} is positive; the other is
 * zero. The database CHECK constraint and {@link LedgerEntryValidator} both
 * enforce this, so a loaded entry always satisfies it.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID transactionId;
    UUID accountId;
    BigDecimal debit;
    BigDecimal credit;
    Long sequenceNumber;
    Instant createdAt;

    public EntryType getEntryType() {
        return Money.isPositive(debit) ? EntryType.DEBIT : EntryType.CREDIT;
    }

    /**
     * The amount on whichever side is populated.
     */
    public BigDecimal getAmount() {
        return getEntryType() == EntryType.DEBIT ? debit : credit;
    }
}
