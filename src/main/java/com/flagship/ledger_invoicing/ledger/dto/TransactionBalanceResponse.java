package com.flagship.ledger_invoicing.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_invoicing.ledger.TransactionBalance;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class TransactionBalanceResponse {

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("total_debit")
    BigDecimal totalDebit;

    @JsonProperty("total_credit")
    BigDecimal totalCredit;

    @JsonProperty("is_balanced")
    boolean balanced;

    public static TransactionBalanceResponse from(TransactionBalance balance) {
        return TransactionBalanceResponse.builder()
            .transactionId(balance.getTransactionId())
            .totalDebit(balance.getTotalDebit())
            .totalCredit(balance.getTotalCredit())
            .balanced(balance.isBalanced())
            .build();
    }
}
