package com.pricegate.application.service;

import com.pricegate.application.port.in.ExchangeRateRefreshUseCase;
import com.pricegate.config.FallbackConstants;
import com.pricegate.domain.model.RateTable;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Use case implementation for exchange rate refresh operations.
 * Keeps the USD table warm and serves user-initiated refreshes with retry and backoff.
 */
@Slf4j
public class ExchangeRateRefreshService implements ExchangeRateRefreshUseCase {

    private final Vertx vertx;
    private final FallbackCascade cascade;
    private final CascadeRequestFactory requests;
    private final RetryWithBackoff retry;
    private final Duration refreshInterval;
    private final CurrencyDirectory currencies;
    private Long timerId;

    public ExchangeRateRefreshService(
            Vertx vertx,
            FallbackCascade cascade,
            CascadeRequestFactory requests,
            RetryWithBackoff retry,
            Duration refreshInterval
    ) {
        this.vertx = vertx;
        this.cascade = cascade;
        this.requests = requests;
        this.retry = retry;
        this.refreshInterval = refreshInterval;
        this.currencies = new CurrencyDirectory(cascade, requests);
    }

    @Override
    public Future<Void> startPeriodicRefresh() {
        log.info("Starting exchange rate refresh (interval: {} minutes)", refreshInterval.toMinutes());

        return refreshRates(FallbackConstants.CURRENCY)
                .onSuccess(table -> {
                    timerId = vertx.setPeriodic(refreshInterval.toMillis(), id -> {
                        log.info("Periodic exchange rate refresh triggered");
                        refreshRates(FallbackConstants.CURRENCY);
                    });
                    log.info("Exchange rate refresh started");
                })
                .mapEmpty();
    }

    @Override
    public void stopPeriodicRefresh() {
        if (timerId != null) {
            vertx.cancelTimer(timerId);
            timerId = null;
            log.info("Exchange rate refresh stopped");
        }
    }

    @Override
    public Future<RateTable> refreshRates(String baseCurrency) {
        return currencies.require(baseCurrency).compose(this::refreshKnownBase);
    }

    private Future<RateTable> refreshKnownBase(String base) {
        log.info("Refreshing {} exchange rates...", base);

        CascadeRequest<RateTable> live = requests.rates(base, true);
        return retry.execute("Refresh " + base + " rates", () -> cascade.fetchLive(live))
                .onSuccess(table -> log.info("{} exchange rates refreshed from {}", base, table.source()))
                .recover(error -> {
                    log.warn("Live refresh of {} rates failed, serving best available: {}", base, error.getMessage());
                    return cascade.resolve(requests.rates(base, false));
                });
    }
}
