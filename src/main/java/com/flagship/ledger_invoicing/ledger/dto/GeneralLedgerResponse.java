package com.flagship.ledger_invoicing.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_invoicing.ledger.Account;
import com.flagship.ledger_invoicing.ledger.GeneralLedger;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class GeneralLedgerResponse {

    @JsonProperty("major_accounts")
    List<MajorAccount> majorAccounts;

    @JsonProperty("total_debit")
    BigDecimal totalDebit;

    @JsonProperty("total_credit")
    BigDecimal totalCredit;

    @JsonProperty("difference")
    BigDecimal difference;

    @JsonProperty("digits")
    int digits;

    @JsonProperty("from")
    LocalDate from;

    @JsonProperty("to")
    LocalDate to;

    public static GeneralLedgerResponse from(GeneralLedger ledger) {
        return GeneralLedgerResponse.builder()
            .majorAccounts(ledger.getMajorAccounts().stream().map(MajorAccount::from).toList())
            .totalDebit(ledger.getTotalDebit())
            .totalCredit(ledger.getTotalCredit())
            .difference(ledger.getDifference())
            .digits(ledger.getDigits())
            .from(ledger.getFrom())
            .to(ledger.getTo())
            .build();
    }

    @Value
    @Builder
    public static class MajorAccount {
        @JsonProperty("code")
        String code;

        @JsonProperty("name")
        String name;

        @JsonProperty("total_debit")
        BigDecimal totalDebit;

        @JsonProperty("total_credit")
        BigDecimal totalCredit;

        @JsonProperty("balance")
        BigDecimal balance;

        @JsonProperty("sub_accounts")
        List<SubAccount> subAccounts;

        static MajorAccount from(GeneralLedger.MajorAccount major) {
            return MajorAccount.builder()
                .code(major.getCode())
                .name(major.getName())
                .totalDebit(major.getTotalDebit())
                .totalCredit(major.getTotalCredit())
                .balance(major.getBalance())
                .subAccounts(major.getSubAccounts().stream().map(SubAccount::from).toList())
                .build();
        }
    }

    @Value
    @Builder
    public static class SubAccount {
        @JsonProperty("code")
        String code;

        @JsonProperty("name")
        String name;

        @JsonProperty("account_type")
        Account.AccountType accountType;

        @JsonProperty("total_debit")
        BigDecimal totalDebit;

        @JsonProperty("total_credit")
        BigDecimal totalCredit;

        @JsonProperty("balance")
        BigDecimal balance;

        static SubAccount from(GeneralLedger.SubAccount sub) {
            return SubAccount.builder()
                .code(sub.getCode())
                .name(sub.getName())
                .accountType(sub.getAccountType())
                .totalDebit(sub.getTotalDebit())
                .totalCredit(sub.getTotalCredit())
                .balance(sub.getBalance())
                .build();
        }
    }
}
