package com.flagship.pocket_ledger.pocket;

import com.flagship.pocket_ledger.account.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Pocket domain object: a named subdivision of an account.
 *
 * A NORMAL pocket's balance is the signed sum of the applied movements that target it
 * directly. A FIXED pocket's balance is derived from its sub-pockets and is only ever
 * rewritten by the recompute pass.
 */
@Value
public class Pocket {
    UUID id;
    UUID accountId;
    String name;
    PocketType type;
    CurrencyCode currency;
    BigDecimal balance;
    Instant createdAt;

    public static Pocket create(UUID id, UUID accountId, String name, PocketType type, CurrencyCode currency,
                                Instant createdAt) {
        return new Pocket(id, accountId, name, type, currency, BigDecimal.ZERO, createdAt);
    }

    public boolean isFixed() {
        return type == PocketType.FIXED;
    }

    /**
     * Applies a signed delta to a NORMAL pocket.
     *
     * @throws IllegalStateException for FIXED pockets, whose balance is derived
     */
    public Pocket applyDelta(BigDecimal delta) {
        if (isFixed()) {
            throw new IllegalStateException(
                String.format("Pocket %s is FIXED; its balance is derived from sub-pockets", id));
        }
        return withBalance(balance.add(delta));
    }

    public Pocket withBalance(BigDecimal newBalance) {
        return new Pocket(id, accountId, name, type, currency, newBalance, createdAt);
    }

    public Pocket withName(String newName) {
        return new Pocket(id, accountId, newName, type, currency, balance, createdAt);
    }

    public Pocket withCurrency(CurrencyCode newCurrency) {
        return new Pocket(id, accountId, name, type, newCurrency, balance, createdAt);
    }
}
