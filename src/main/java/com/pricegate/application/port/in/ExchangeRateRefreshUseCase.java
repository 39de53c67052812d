package com.pricegate.application.port.in;

import com.pricegate.domain.model.RateTable;
import io.vertx.core.Future;

/**
 * Input port for exchange rate refresh operations
 */
public interface ExchangeRateRefreshUseCase {

    /**
     * Start the periodic refresh of the USD rate table.
     * Performs an initial refresh immediately, then one per rate TTL.
     */
    Future<Void> startPeriodicRefresh();

    void stopPeriodicRefresh();

    /**
     * Refresh triggered by the user, retried with backoff before falling back to cached tiers
     */
    Future<RateTable> refreshRates(String baseCurrency);
}
