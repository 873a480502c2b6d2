package com.flagship.ledger_invoicing.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_invoicing.ledger.Account;
import com.flagship.ledger_invoicing.ledger.AccountBalance;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class AccountBalanceResponse {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("code")
    String code;

    @JsonProperty("account_type")
    Account.AccountType accountType;

    @JsonProperty("total_debit")
    BigDecimal totalDebit;

    @JsonProperty("total_credit")
    BigDecimal totalCredit;

    @JsonProperty("balance")
    BigDecimal balance;

    public static AccountBalanceResponse from(AccountBalance balance) {
        return AccountBalanceResponse.builder()
            .accountId(balance.getAccountId())
            .code(balance.getCode())
            .accountType(balance.getAccountType())
            .totalDebit(balance.getTotalDebit())
            .totalCredit(balance.getTotalCredit())
            .balance(balance.getBalance())
            .build();
    }
}
