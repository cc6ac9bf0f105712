package com.flagship.pocket_ledger.account;

/**
 * Currency code enum following ISO-4217.
 *
 * Accounts are single-currency; pockets inherit the currency of their account.
 */
public enum CurrencyCode {
    USD, // US Dollar
    EUR, // Euro
    GBP, // British Pound
    MXN, // Mexican Peso
    COP  // Colombian Peso
}
