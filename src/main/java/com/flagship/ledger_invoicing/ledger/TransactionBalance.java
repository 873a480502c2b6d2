package com.flagship.ledger_invoicing.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Debit and credit totals of a transaction. Advisory only: an unbalanced
 * transaction is a valid stored state.
 */
@Value
public class TransactionBalance {
    UUID transactionId;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    boolean balanced;

    static TransactionBalance of(UUID transactionId, BigDecimal totalDebit, BigDecimal totalCredit) {
        return new TransactionBalance(
            transactionId,
            totalDebit,
            totalCredit,
            totalDebit.compareTo(totalCredit) == 0
        );
    }
}
