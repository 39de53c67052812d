package com.pricegate.application.service;

import com.pricegate.application.port.out.RequestCounterRepository;
import com.pricegate.domain.model.RequestCounter;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.YearMonth;
import java.time.ZoneOffset;

/**
 * Request budget of a provider with a monthly usage quota.
 * The counter restarts at zero when the calendar month changes.
 */
@Slf4j
@RequiredArgsConstructor
public class MonthlyRequestQuota {

    private final RequestCounterRepository repository;
    private final int monthlyLimit;
    private final Clock clock;

    /**
     * Spend one request if the budget allows it
     * @return Future with false when the month's budget is used up
     */
    public Future<Boolean> tryAcquire() {
        return current().compose(counter -> {
            if (counter.count() >= monthlyLimit) {
                log.warn("Monthly request quota exhausted ({}/{})", counter.count(), monthlyLimit);
                return Future.succeededFuture(false);
            }
            return repository.save(counter.increment()).map(true);
        });
    }

    public Future<RequestCounter> current() {
        YearMonth month = YearMonth.now(clock.withZone(ZoneOffset.UTC));
        return repository.load().compose(stored -> {
            if (stored.isPresent() && stored.get().isFor(month)) {
                return Future.succeededFuture(stored.get());
            }
            RequestCounter fresh = RequestCounter.startOf(month);
            log.info("Starting request counter for {}", month);
            return repository.save(fresh).map(fresh);
        });
    }

    public int getMonthlyLimit() {
        return monthlyLimit;
    }
}
