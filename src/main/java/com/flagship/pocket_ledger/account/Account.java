package com.flagship.pocket_ledger.account;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Account domain object.
 *
 * The balance is never authoritative: it is rewritten by every recompute pass from the
 * account's pockets (NORMAL) or from share count and market price (INVESTMENT).
 * {@code investedAmount} and {@code shareCount} are accumulated from investment movements.
 * {@code displayOrder} positions the account in listings, lowest first.
 *
 * State changes are immutable: every change returns a new Account.
 */
@Value
public class Account {
    public static final String DEFAULT_STOCK_SYMBOL = "VOO";

    UUID id;
    String name;
    String color;
    CurrencyCode currency;
    BigDecimal balance;
    AccountType type;
    String stockSymbol;
    BigDecimal investedAmount;
    BigDecimal shareCount;
    Instant createdAt;
    int displayOrder;

    public static Account createNormal(UUID id, String name, String color, CurrencyCode currency,
                                       Instant createdAt, int displayOrder) {
        return new Account(id, name, color, currency, BigDecimal.ZERO, AccountType.NORMAL,
            null, null, null, createdAt, displayOrder);
    }

    public static Account createInvestment(UUID id, String name, String color, CurrencyCode currency,
                                           String stockSymbol, Instant createdAt, int displayOrder) {
        String symbol = stockSymbol == null || stockSymbol.isBlank()
            ? DEFAULT_STOCK_SYMBOL
            : stockSymbol.trim().toUpperCase();
        return new Account(id, name, color, currency, BigDecimal.ZERO, AccountType.INVESTMENT,
            symbol, BigDecimal.ZERO, BigDecimal.ZERO, createdAt, displayOrder);
    }

    public boolean isInvestment() {
        return type == AccountType.INVESTMENT;
    }

    public Account withBalance(BigDecimal newBalance) {
        return new Account(id, name, color, currency, newBalance, type, stockSymbol,
            investedAmount, shareCount, createdAt, displayOrder);
    }

    public Account withDetails(String newName, String newColor, CurrencyCode newCurrency) {
        return new Account(id, newName, newColor, newCurrency, balance, type, stockSymbol,
            investedAmount, shareCount, createdAt, displayOrder);
    }

    public Account withDisplayOrder(int newDisplayOrder) {
        return new Account(id, name, color, currency, balance, type, stockSymbol,
            investedAmount, shareCount, createdAt, newDisplayOrder);
    }

    /**
     * Returns a copy with new investment fields.
     *
     * @throws IllegalStateException if this is not an investment account
     */
    public Account withInvestmentFields(BigDecimal newInvestedAmount, BigDecimal newShareCount) {
        if (!isInvestment()) {
            throw new IllegalStateException(
                String.format("Account %s is %s; investment fields only exist on INVESTMENT accounts", id, type));
        }
        return new Account(id, name, color, currency, balance, type, stockSymbol,
            newInvestedAmount, newShareCount, createdAt, displayOrder);
    }
}
