package com.flagship.ledger_invoicing.ledger;

/**
 * ISO-4217 codes accepted on transactions.
 */
public enum CurrencyCode {
    USD, // US Dollar
    EUR, // Euro
    GBP, // British Pound
    GTQ, // Guatemalan Quetzal
    MXN  // Mexican Peso
}
