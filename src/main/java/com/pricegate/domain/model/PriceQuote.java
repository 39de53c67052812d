package com.pricegate.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Price of one instrument in one currency. Immutable; re-tagging creates a copy.
 *
 * <p>Values are positive, except the floor served for an equity or crypto asset with no known
 * price: a zero value with {@code isFallback} set and {@code cacheSource} {@link ServedFrom#CONSTANT}.
 */
public record PriceQuote(
        String symbol,
        BigDecimal value,
        String currency,
        Instant asOf,
        String source,
        @JsonProperty("isFallback") boolean fallback,
        ServedFrom cacheSource
) implements Quotation<PriceQuote> {

    public static PriceQuote live(String symbol, BigDecimal value, String currency, Instant asOf, String source) {
        return new PriceQuote(symbol, value, currency, asOf, source, false, ServedFrom.LIVE);
    }

    @Override
    public PriceQuote servedAs(ServedFrom tier, String newSource) {
        return new PriceQuote(symbol, value, currency, asOf, newSource, tier.isFallback(), tier);
    }

    /**
     * Same quote expressed in another currency. An estimated rate makes the result a fallback too.
     */
    public PriceQuote convertedTo(BigDecimal convertedValue, String targetCurrency, boolean estimatedRate) {
        return new PriceQuote(symbol, convertedValue, targetCurrency, asOf, source, fallback || estimatedRate, cacheSource);
    }
}
