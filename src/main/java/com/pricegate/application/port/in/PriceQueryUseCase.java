package com.pricegate.application.port.in;

import com.pricegate.domain.model.DataKind;
import com.pricegate.domain.model.GatewayStatus;
import com.pricegate.domain.model.MetalPrices;
import com.pricegate.domain.model.PriceQuote;
import com.pricegate.domain.model.RateTable;
import io.vertx.core.Future;

import java.math.BigDecimal;
import java.util.List;

/**
 * Input port for price and rate lookups.
 * Every operation completes successfully; degraded values are tagged {@code isFallback=true}.
 */
public interface PriceQueryUseCase {

    /**
     * Price of one instrument in the target currency
     * @param kind Data kind
     * @param symbol Equity ticker, metal name ({@code gold}/{@code silver}), crypto ticker or currency code
     * @param targetCurrency ISO 4217 code
     * @return Future with the quote
     */
    Future<PriceQuote> getPrice(DataKind kind, String symbol, String targetCurrency);

    Future<MetalPrices> getMetalPrices(String currency, boolean refresh);

    /**
     * One independent lookup per currency, run concurrently
     */
    Future<List<MetalPrices>> getMetalPrices(List<String> currencies);

    /**
     * Fails with {@link IllegalArgumentException} for a base no known rate table lists
     */
    Future<RateTable> getRateTable(String baseCurrency);

    /**
     * Convert an amount; returns it unconverted when no rate at all is available
     */
    Future<BigDecimal> convert(BigDecimal amount, String from, String to);

    /**
     * Drop every in-memory cache entry. The snapshot file is kept.
     */
    void resetCaches();

    Future<GatewayStatus> status();
}
