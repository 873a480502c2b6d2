package com.flagship.ledger_invoicing.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An entry of the chart of accounts. Read-only to the ledger once entries
 * reference it.
 */
@Value
public class Account {
    UUID id;
    String code;
    String name;
    AccountType accountType;
    Instant createdAt;

    public enum AccountType {
        ASSET(true),
        LIABILITY(false),
        EQUITY(false),
        INCOME(false),
        EXPENSE(true);

        private final boolean debitNormal;

        AccountType(boolean debitNormal) {
            this.debitNormal = debitNormal;
        }

        /**
         * Debit-normal accounts grow with debits; the rest grow with credits.
         */
        public boolean isDebitNormal() {
            return debitNormal;
        }
    }
}
