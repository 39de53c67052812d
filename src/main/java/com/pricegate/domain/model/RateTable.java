package com.pricegate.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Exchange rates of many currencies against one base currency.
 * Rebuilt wholesale on every fetch, never mutated.
 */
public record RateTable(
        String base,
        Map<String, BigDecimal> rates,
        Instant asOf,
        String source,
        @JsonProperty("isFallback") boolean fallback,
        ServedFrom cacheSource
) implements Quotation<RateTable> {

    public RateTable {
        rates = rates == null ? Map.of() : Map.copyOf(rates);
    }

    public static RateTable live(String base, Map<String, BigDecimal> rates, Instant asOf, String source) {
        return new RateTable(base, rates, asOf, source, false, ServedFrom.LIVE);
    }

    @Override
    public RateTable servedAs(ServedFrom tier, String newSource) {
        return new RateTable(base, rates, asOf, newSource, tier.isFallback(), tier);
    }

    /**
     * Units of {@code currency} per one unit of the base; the base itself is always 1
     */
    public Optional<BigDecimal> rateOf(String currency) {
        if (currency == null) {
            return Optional.empty();
        }
        if (currency.equalsIgnoreCase(base)) {
            return Optional.of(BigDecimal.ONE);
        }
        return Optional.ofNullable(rates.get(currency.toUpperCase()));
    }
}
