package com.pricegate.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Gold and silver prices per gram, always fetched together from one provider
 */
public record MetalPrices(
        BigDecimal gold,
        BigDecimal silver,
        String currency,
        Instant asOf,
        String source,
        @JsonProperty("isFallback") boolean fallback,
        ServedFrom cacheSource
) implements Quotation<MetalPrices> {

    public static MetalPrices live(BigDecimal gold, BigDecimal silver, String currency, Instant asOf, String source) {
        return new MetalPrices(gold, silver, currency, asOf, source, false, ServedFrom.LIVE);
    }

    @Override
    public MetalPrices servedAs(ServedFrom tier, String newSource) {
        return new MetalPrices(gold, silver, currency, asOf, newSource, tier.isFallback(), tier);
    }

    public MetalPrices convertedTo(BigDecimal convertedGold, BigDecimal convertedSilver,
                                   String targetCurrency, boolean estimatedRate) {
        return new MetalPrices(convertedGold, convertedSilver, targetCurrency, asOf, source,
                fallback || estimatedRate, cacheSource);
    }

    public BigDecimal priceOf(Metal metal) {
        return metal == Metal.GOLD ? gold : silver;
    }

    public PriceQuote toQuote(Metal metal) {
        return new PriceQuote(metal.getValue(), priceOf(metal), currency, asOf, source, fallback, cacheSource);
    }
}
