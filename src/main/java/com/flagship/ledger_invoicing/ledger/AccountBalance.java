package com.flagship.ledger_invoicing.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Account totals and the balance read on the account's normal side.
 */
@Value
public class AccountBalance {
    UUID accountId;
    String code;
    Account.AccountType accountType;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    BigDecimal balance;
}
