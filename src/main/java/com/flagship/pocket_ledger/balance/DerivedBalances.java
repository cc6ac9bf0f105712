package com.flagship.pocket_ledger.balance;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * Output of one derivation pass for a single account.
 */
@Value
public class DerivedBalances {
    UUID accountId;
    BigDecimal accountBalance;
    /** Derived balance per FIXED pocket of the account. */
    Map<UUID, BigDecimal> fixedPocketBalances;
}
