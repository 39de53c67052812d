package com.pricegate.application.service;

import com.pricegate.application.port.in.PriceQueryUseCase;
import com.pricegate.application.port.out.SnapshotRepository;
import com.pricegate.config.FallbackConstants;
import com.pricegate.domain.model.CryptoAsset;
import com.pricegate.domain.model.DataKind;
import com.pricegate.domain.model.GatewayStatus;
import com.pricegate.domain.model.Metal;
import com.pricegate.domain.model.MetalPrices;
import com.pricegate.domain.model.PriceQuote;
import com.pricegate.domain.model.RateTable;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Use case implementation for price and rate lookups.
 * Values are acquired in USD through the cascade and converted with the USD rate table.
 */
@Slf4j
public class PriceQueryService implements PriceQueryUseCase {

    private static final int METAL_SCALE = 2;

    private final FallbackCascade cascade;
    private final CascadeRequestFactory requests;
    private final RateConverter converter;
    private final CircuitBreakerRegistry breakers;
    private final MonthlyRequestQuota quota;
    private final SnapshotRepository<MetalPrices> metalSnapshot;
    private final CurrencyDirectory currencies;

    public PriceQueryService(
            FallbackCascade cascade,
            CascadeRequestFactory requests,
            RateConverter converter,
            CircuitBreakerRegistry breakers,
            MonthlyRequestQuota quota,
            SnapshotRepository<MetalPrices> metalSnapshot
    ) {
        this.cascade = cascade;
        this.requests = requests;
        this.converter = converter;
        this.breakers = breakers;
        this.quota = quota;
        this.metalSnapshot = metalSnapshot;
        this.currencies = new CurrencyDirectory(cascade, requests);
    }

    @Override
    public Future<PriceQuote> getPrice(DataKind kind, String symbol, String targetCurrency) {
        if (symbol == null || symbol.isBlank()) {
            return Future.failedFuture(new IllegalArgumentException("symbol is required"));
        }
        String target;
        try {
            target = currencyCode(targetCurrency);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }

        switch (kind) {
            case METAL:
                Metal metal;
                try {
                    metal = Metal.fromValue(symbol);
                } catch (IllegalArgumentException e) {
                    return Future.failedFuture(e);
                }
                return getMetalPrices(target, false).map(prices -> prices.toQuote(metal));
            case EQUITY:
                return cascade.resolve(requests.equity(symbol)).compose(quote -> quoteIn(quote, target));
            case CRYPTO:
                CryptoAsset asset;
                try {
                    asset = CryptoAsset.fromSymbol(symbol);
                } catch (IllegalArgumentException e) {
                    return Future.failedFuture(e);
                }
                return cascade.resolve(requests.crypto(asset.name())).compose(quote -> quoteIn(quote, target));
            default:
                return rateQuote(symbol.trim().toUpperCase(), target);
        }
    }

    @Override
    public Future<MetalPrices> getMetalPrices(String currency, boolean refresh) {
        String target;
        try {
            target = currencyCode(currency);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
        return cascade.resolve(requests.metals(refresh)).compose(prices -> pricesIn(prices, target));
    }

    @Override
    public Future<List<MetalPrices>> getMetalPrices(List<String> currencies) {
        List<Future<MetalPrices>> lookups = new ArrayList<>();
        for (String currency : currencies) {
            lookups.add(getMetalPrices(currency, false));
        }
        return Future.all(lookups).map(all -> all.<MetalPrices>list());
    }

    @Override
    public Future<RateTable> getRateTable(String baseCurrency) {
        return currencies.require(baseCurrency).compose(base -> cascade.resolve(requests.rates(base, false)));
    }

    @Override
    public Future<BigDecimal> convert(BigDecimal amount, String from, String to) {
        if (amount == null) {
            return Future.failedFuture(new IllegalArgumentException("amount is required"));
        }
        String source;
        String target;
        try {
            source = currencyCode(from);
            target = currencyCode(to);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
        if (source.equals(target)) {
            return Future.succeededFuture(amount);
        }
        return usdTable().map(table -> converter.convert(amount, source, target, table));
    }

    @Override
    public void resetCaches() {
        log.info("Resetting in-memory caches");
        requests.resetCaches();
    }

    @Override
    public Future<GatewayStatus> status() {
        return Future.all(quota.current().otherwiseEmpty(), metalSnapshot.exists().otherwise(false))
                .map(all -> new GatewayStatus(
                        breakers.states(),
                        all.resultAt(0),
                        quota.getMonthlyLimit(),
                        all.resultAt(1),
                        requests.cacheSizes()
                ));
    }

    private Future<RateTable> usdTable() {
        return cascade.resolve(requests.rates(FallbackConstants.CURRENCY, false));
    }

    private Future<MetalPrices> pricesIn(MetalPrices prices, String target) {
        if (prices.currency().equals(target)) {
            return Future.succeededFuture(prices);
        }
        return usdTable().map(table -> {
            RateConverter.Conversion gold = converter.convertDetailed(prices.gold(), prices.currency(), target, table);
            RateConverter.Conversion silver = converter.convertDetailed(prices.silver(), prices.currency(), target, table);
            if (gold.path() == RateConverter.ConversionPath.UNCONVERTED
                    || silver.path() == RateConverter.ConversionPath.UNCONVERTED) {
                // Labelled in the currency the amounts are actually in
                return prices.convertedTo(prices.gold(), prices.silver(), prices.currency(), true);
            }
            return prices.convertedTo(
                    gold.amount().setScale(METAL_SCALE, RoundingMode.HALF_UP),
                    silver.amount().setScale(METAL_SCALE, RoundingMode.HALF_UP),
                    target,
                    gold.path().isEstimate() || silver.path().isEstimate());
        });
    }

    private Future<PriceQuote> quoteIn(PriceQuote quote, String target) {
        if (quote.currency().equals(target)) {
            return Future.succeededFuture(quote);
        }
        return usdTable().map(table -> {
            RateConverter.Conversion conversion = converter.convertDetailed(quote.value(), quote.currency(), target, table);
            if (conversion.path() == RateConverter.ConversionPath.UNCONVERTED) {
                return quote.convertedTo(quote.value(), quote.currency(), true);
            }
            return quote.convertedTo(conversion.amount(), target, conversion.path().isEstimate());
        });
    }

    /**
     * Value of one unit of {@code currency} in {@code target}
     */
    private Future<PriceQuote> rateQuote(String currency, String target) {
        String from;
        try {
            from = currencyCode(currency);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
        return usdTable().map(table -> {
            RateConverter.Conversion conversion = converter.convertDetailed(BigDecimal.ONE, from, target, table);
            boolean unconverted = conversion.path() == RateConverter.ConversionPath.UNCONVERTED;
            return new PriceQuote(
                    from,
                    conversion.amount(),
                    unconverted ? from : target,
                    table.asOf(),
                    table.source(),
                    table.fallback() || conversion.path().isEstimate(),
                    table.cacheSource());
        });
    }

    static String currencyCode(String currency) {
        if (currency == null || !currency.trim().matches("[A-Za-z]{3}")) {
            throw new IllegalArgumentException("Invalid currency code: " + currency);
        }
        return currency.trim().toUpperCase();
    }
}
