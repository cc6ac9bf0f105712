package com.flagship.pocket_ledger.price;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Price source reading fixed quotes from configuration ({@code ledger.prices.<SYMBOL>}).
 * Used when no live market feed is wired in.
 */
public class ConfiguredPriceSource implements PriceSource {

    private final Map<String, BigDecimal> prices;

    public ConfiguredPriceSource(Map<String, BigDecimal> prices) {
        this.prices = prices == null ? Map.of() : prices.entrySet().stream()
            .collect(Collectors.toUnmodifiableMap(e -> normalize(e.getKey()), Map.Entry::getValue));
    }

    @Override
    public Optional<BigDecimal> fetch(String symbol) {
        return symbol == null ? Optional.empty() : Optional.ofNullable(prices.get(normalize(symbol)));
    }

    private static String normalize(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
