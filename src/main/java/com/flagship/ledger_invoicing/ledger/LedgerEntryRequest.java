package com.flagship.ledger_invoicing.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Proposed ledger entry, before validation.
 */
@Value
public class LedgerEntryRequest {
    UUID transactionId;
    UUID accountId;
    BigDecimal debit;
    BigDecimal credit;

    public static LedgerEntryRequest debit(UUID transactionId, UUID accountId, BigDecimal amount) {
        return new LedgerEntryRequest(transactionId, accountId, amount, BigDecimal.ZERO);
    }

    public static LedgerEntryRequest credit(UUID transactionId, UUID accountId, BigDecimal amount) {
        return new LedgerEntryRequest(transactionId, accountId, BigDecimal.ZERO, amount);
    }
}
