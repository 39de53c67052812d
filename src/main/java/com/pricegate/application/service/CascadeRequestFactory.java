package com.pricegate.application.service;

import com.pricegate.application.port.out.SnapshotRepository;
import com.pricegate.config.FallbackConstants;
import com.pricegate.config.ResilienceSettings;
import com.pricegate.domain.model.DataKind;
import com.pricegate.domain.model.MetalPrices;
import com.pricegate.domain.model.PriceQuote;
import com.pricegate.domain.model.RateTable;
import com.pricegate.domain.model.SourceParams;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Builds the cascade request of each data kind: sources in call order, cache, validators and floors.
 * Metal prices are always acquired in USD and converted afterwards, so one cache entry serves
 * every currency.
 */
public class CascadeRequestFactory {

    private final SourceRegistry registry;
    private final QuoteValidator validator;
    private final SnapshotRepository<MetalPrices> metalSnapshot;
    private final ResilienceSettings settings;
    private final Clock clock;
    private final LongSupplier seeds;

    private final CacheStore<MetalPrices> metalCache;
    private final CacheStore<PriceQuote> equityCache;
    private final CacheStore<RateTable> rateCache;
    private final CacheStore<PriceQuote> cryptoCache;

    public CascadeRequestFactory(SourceRegistry registry, QuoteValidator validator,
                                 SnapshotRepository<MetalPrices> metalSnapshot, ResilienceSettings settings,
                                 Clock clock, LongSupplier seeds) {
        this.registry = registry;
        this.validator = validator;
        this.metalSnapshot = metalSnapshot;
        this.settings = settings;
        this.clock = clock;
        this.seeds = seeds;
        this.metalCache = new CacheStore<>("metal", clock, settings.getClockSkewTolerance());
        this.equityCache = new CacheStore<>("equity", clock, settings.getClockSkewTolerance());
        this.rateCache = new CacheStore<>("exchange-rate", clock, settings.getClockSkewTolerance());
        this.cryptoCache = new CacheStore<>("crypto", clock, settings.getClockSkewTolerance());
    }

    public CascadeRequest<MetalPrices> metals(boolean refresh) {
        return CascadeRequest.<MetalPrices>builder()
                .kind(DataKind.METAL)
                .cacheKey("metals:" + FallbackConstants.CURRENCY)
                .params(SourceParams.none())
                .sources(registry.metalSources(seeds.getAsLong()))
                .cache(metalCache)
                .ttl(settings.getMetalTtl())
                .validator(prices -> validator.validateMetals(prices, settings.getMaxUpstreamAge()))
                .relaxedValidator(prices -> validator.validateMetals(prices, null))
                .snapshot(metalSnapshot)
                .constant(() -> MetalPrices.live(FallbackConstants.GOLD_USD_PER_GRAM,
                        FallbackConstants.SILVER_USD_PER_GRAM, FallbackConstants.CURRENCY, clock.instant(), null))
                .refresh(refresh)
                .build();
    }

    /**
     * Equities are quoted in USD by every registered provider.
     * Without any known price the floor is a zero quote, flagged as fallback.
     */
    public CascadeRequest<PriceQuote> equity(String symbol) {
        String normalized = symbol.trim().toUpperCase();
        return CascadeRequest.<PriceQuote>builder()
                .kind(DataKind.EQUITY)
                .cacheKey("equity:" + normalized)
                .params(SourceParams.forSymbol(normalized))
                .sources(registry.equitySources(seeds.getAsLong()))
                .cache(equityCache)
                .ttl(settings.getEquityTtl())
                .validator(quote -> validator.validatePrice(quote, settings.getMaxUpstreamAge()))
                .relaxedValidator(quote -> validator.validatePrice(quote, null))
                .constant(() -> PriceQuote.live(normalized, BigDecimal.ZERO, FallbackConstants.CURRENCY,
                        clock.instant(), null))
                .build();
    }

    /**
     * Crypto prices are acquired in USD; the symbol must name a {@link com.pricegate.domain.model.CryptoAsset}.
     * The floor is a zero quote, flagged as fallback.
     */
    public CascadeRequest<PriceQuote> crypto(String symbol) {
        String normalized = symbol.trim().toUpperCase();
        return CascadeRequest.<PriceQuote>builder()
                .kind(DataKind.CRYPTO)
                .cacheKey("crypto:" + normalized)
                .params(SourceParams.forSymbol(normalized))
                .sources(registry.cryptoSources(seeds.getAsLong()))
                .cache(cryptoCache)
                .ttl(settings.getCryptoTtl())
                .validator(quote -> validator.validatePrice(quote, settings.getMaxUpstreamAge()))
                .relaxedValidator(quote -> validator.validatePrice(quote, null))
                .constant(() -> PriceQuote.live(normalized, BigDecimal.ZERO, FallbackConstants.CURRENCY,
                        clock.instant(), null))
                .build();
    }

    public CascadeRequest<RateTable> rates(String base, boolean refresh) {
        String normalized = base.trim().toUpperCase();
        return CascadeRequest.<RateTable>builder()
                .kind(DataKind.EXCHANGE_RATE)
                .cacheKey("rates:" + normalized)
                .params(SourceParams.forBase(normalized))
                .sources(registry.rateSources(seeds.getAsLong()))
                .cache(rateCache)
                .ttl(settings.getRateTtl())
                .validator(table -> validator.validateRateTable(table, settings.getMaxUpstreamAge()))
                .relaxedValidator(table -> validator.validateRateTable(table, null))
                .constant(() -> constantRates(normalized))
                .refresh(refresh)
                .build();
    }

    /**
     * Hardcoded USD table rebased onto the requested base when the base is in it.
     * Otherwise the USD table itself, which still converts any pair it contains.
     */
    RateTable constantRates(String base) {
        BigDecimal baseRate = FallbackConstants.USD_RATES.get(base);
        if (baseRate == null) {
            return RateTable.live(FallbackConstants.CURRENCY, FallbackConstants.USD_RATES, clock.instant(), null);
        }
        Map<String, BigDecimal> rebased = new HashMap<>();
        FallbackConstants.USD_RATES.forEach((currency, rate) ->
                rebased.put(currency, rate.divide(baseRate, MathContext.DECIMAL64)));
        return RateTable.live(base, rebased, clock.instant(), null);
    }

    public void resetCaches() {
        metalCache.clear();
        equityCache.clear();
        rateCache.clear();
        cryptoCache.clear();
    }

    public Map<String, Integer> cacheSizes() {
        Map<String, Integer> sizes = new HashMap<>();
        sizes.put(metalCache.getName(), metalCache.size());
        sizes.put(equityCache.getName(), equityCache.size());
        sizes.put(rateCache.getName(), rateCache.size());
        sizes.put(cryptoCache.getName(), cryptoCache.size());
        return sizes;
    }

    CacheStore<MetalPrices> metalCache() {
        return metalCache;
    }

    CacheStore<PriceQuote> equityCache() {
        return equityCache;
    }

    CacheStore<RateTable> rateCache() {
        return rateCache;
    }

    CacheStore<PriceQuote> cryptoCache() {
        return cryptoCache;
    }
}
