package com.flagship.pocket_ledger.balance;

import com.flagship.pocket_ledger.account.Account;
import com.flagship.pocket_ledger.pocket.Pocket;
import com.flagship.pocket_ledger.subpocket.SubPocket;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Pure balance derivation.
 *
 * Inputs are the lowest-level authoritative balances only: sub-pocket balances and the
 * balances of NORMAL pockets. Stored FIXED pocket balances and the stored account
 * balance are never read, so running the derivation twice yields identical output.
 */
public final class BalanceDerivation {

    static final int MARKET_VALUE_SCALE = 4;

    private BalanceDerivation() {
        // Utility class
    }

    /**
     * @param account            the account being derived
     * @param pockets            every pocket of the account
     * @param subPocketsByPocket sub-pockets keyed by FIXED pocket id
     * @param marketPrice        current price of the account's symbol (investment accounts only)
     */
    public static DerivedBalances derive(Account account,
                                         List<Pocket> pockets,
                                         Map<UUID, List<SubPocket>> subPocketsByPocket,
                                         Optional<BigDecimal> marketPrice) {
        Map<UUID, BigDecimal> fixedBalances = new LinkedHashMap<>();
        BigDecimal pocketTotal = BigDecimal.ZERO;

        for (Pocket pocket : pockets) {
            BigDecimal pocketBalance;
            if (pocket.isFixed()) {
                pocketBalance = sum(subPocketsByPocket.getOrDefault(pocket.getId(), List.of()));
                fixedBalances.put(pocket.getId(), pocketBalance);
            } else {
                pocketBalance = pocket.getBalance();
            }
            pocketTotal = pocketTotal.add(pocketBalance);
        }

        BigDecimal accountBalance = account.isInvestment()
            ? marketValue(account, marketPrice)
            : pocketTotal;

        return new DerivedBalances(account.getId(), accountBalance, fixedBalances);
    }

    /**
     * shareCount × price; falls back to the invested amount when no price is available.
     */
    static BigDecimal marketValue(Account account, Optional<BigDecimal> marketPrice) {
        BigDecimal shares = account.getShareCount() != null ? account.getShareCount() : BigDecimal.ZERO;
        return marketPrice
            .map(price -> shares.multiply(price).setScale(MARKET_VALUE_SCALE, RoundingMode.HALF_UP))
            .orElseGet(() -> account.getInvestedAmount() != null ? account.getInvestedAmount() : BigDecimal.ZERO);
    }

    private static BigDecimal sum(List<SubPocket> subPockets) {
        return subPockets.stream()
            .map(SubPocket::getBalance)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
