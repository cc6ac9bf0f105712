package com.flagship.pocket_ledger.price;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Current market price used to value investment accounts.
 */
public interface PriceLookup {

    Optional<BigDecimal> currentPrice(String symbol);
}
