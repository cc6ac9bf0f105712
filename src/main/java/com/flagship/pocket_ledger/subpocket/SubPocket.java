package com.flagship.pocket_ledger.subpocket;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * SubPocket domain object: one recurring obligation inside the fixed pocket.
 *
 * The balance is signed. A negative balance is debt; a balance above
 * {@code targetValue} is overpayment. Both are legal states.
 */
@Value
public class SubPocket {
    private static final int MONEY_SCALE = 2;
    private static final int PROGRESS_SCALE = 4;

    UUID id;
    UUID pocketId;
    String name;
    BigDecimal targetValue;
    int periodicityMonths;
    BigDecimal balance;
    boolean enabled;
    Instant createdAt;

    public static SubPocket create(UUID id, UUID pocketId, String name, BigDecimal targetValue,
                                   int periodicityMonths, Instant createdAt) {
        return new SubPocket(id, pocketId, name, targetValue, periodicityMonths, BigDecimal.ZERO, true,
            createdAt);
    }

    /**
     * Regular monthly installment: target amortized over the periodicity.
     */
    public BigDecimal monthlyAmount() {
        if (periodicityMonths <= 0) {
            return BigDecimal.ZERO;
        }
        return targetValue.divide(BigDecimal.valueOf(periodicityMonths), MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Amount required this month.
     *
     * <ul>
     *   <li>debt: the installment plus the whole deficit</li>
     *   <li>less than one installment left: only what remains (zero once the target is reached)</li>
     *   <li>otherwise: the installment</li>
     * </ul>
     * Disabled sub-pockets require nothing.
     */
    public BigDecimal requiredContribution() {
        if (!enabled) {
            return BigDecimal.ZERO;
        }
        BigDecimal monthly = monthlyAmount();
        if (balance.signum() < 0) {
            return monthly.add(balance.abs());
        }
        BigDecimal remaining = targetValue.subtract(balance);
        if (remaining.compareTo(monthly) < 0) {
            return remaining.max(BigDecimal.ZERO);
        }
        return monthly;
    }

    /**
     * balance / target. Negative in debt, above 1 when overpaid.
     */
    public BigDecimal progress() {
        if (targetValue.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return balance.divide(targetValue, PROGRESS_SCALE, RoundingMode.HALF_UP);
    }

    public SubPocket applyDelta(BigDecimal delta) {
        return withBalance(balance.add(delta));
    }

    public SubPocket withBalance(BigDecimal newBalance) {
        return new SubPocket(id, pocketId, name, targetValue, periodicityMonths, newBalance, enabled, createdAt);
    }

    public SubPocket withTerms(String newName, BigDecimal newTargetValue, int newPeriodicityMonths) {
        return new SubPocket(id, pocketId, newName, newTargetValue, newPeriodicityMonths, balance, enabled, createdAt);
    }

    public SubPocket toggled() {
        return new SubPocket(id, pocketId, name, targetValue, periodicityMonths, balance, !enabled, createdAt);
    }
}
