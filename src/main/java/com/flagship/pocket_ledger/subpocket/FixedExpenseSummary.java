package com.flagship.pocket_ledger.subpocket;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Monthly totals over the enabled sub-pockets of a fixed pocket.
 */
@Value
public class FixedExpenseSummary {
    UUID pocketId;
    BigDecimal totalMonthly;
    BigDecimal totalRequired;
    int enabledCount;
}
