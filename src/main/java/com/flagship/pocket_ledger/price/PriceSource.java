package com.flagship.pocket_ledger.price;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * External market price source. Opaque to the ledger core.
 */
public interface PriceSource {

    /**
     * @return the latest price for the symbol, or empty if the source has none
     */
    Optional<BigDecimal> fetch(String symbol);
}
