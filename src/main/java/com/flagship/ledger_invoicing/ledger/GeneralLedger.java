package com.flagship.ledger_invoicing.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Account totals grouped by major account (the first N digits of the code).
 */
@Value
public class GeneralLedger {
    List<MajorAccount> majorAccounts;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    BigDecimal difference;
    int digits;
    LocalDate from;
    LocalDate to;

    @Value
    public static class MajorAccount {
        String code;
        String name;
        BigDecimal totalDebit;
        BigDecimal totalCredit;
        BigDecimal balance;
        List<SubAccount> subAccounts;
    }

    @Value
    public static class SubAccount {
        String code;
        String name;
        Account.AccountType accountType;
        BigDecimal totalDebit;
        BigDecimal totalCredit;
        BigDecimal balance;
    }
}
