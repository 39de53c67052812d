package com.pricegate.application.service;

import com.pricegate.application.port.out.PriceSourceFetcher;
import com.pricegate.application.port.out.SnapshotRepository;
import com.pricegate.application.port.out.SourceDescriptor;
import com.pricegate.config.ResilienceSettings;
import com.pricegate.domain.model.DataKind;
import com.pricegate.domain.model.MetalPrices;
import com.pricegate.domain.model.RateTable;
import com.pricegate.domain.model.ServedFrom;
import com.pricegate.domain.model.SourceParams;
import com.pricegate.exception.UpstreamStatusException;
import com.pricegate.support.MutableClock;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.pricegate.support.Futures.await;
import static com.pricegate.support.Futures.awaitFailure;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit test for ExchangeRateRefreshService
 * Real Vert.x timers drive the backoff; the fetcher is mocked
 */
class ExchangeRateRefreshServiceTest {

    @Mock
    private PriceSourceFetcher fetcher;

    @Mock
    private SnapshotRepository<MetalPrices> snapshot;

    @Mock
    private MonthlyRequestQuota quota;

    private Vertx vertx;
    private MutableClock clock;
    private SourceDescriptor<RateTable> rateSource;
    private ExchangeRateRefreshService service;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        vertx = Vertx.vertx();
        clock = MutableClock.at("2024-03-01T12:00:00Z");
        ResilienceSettings settings = ResilienceSettings.defaults();

        rateSource = SourceDescriptor.<RateTable>builder()
                .name("currency-api-jsdelivr").kind(DataKind.EXCHANGE_RATE)
                .endpoint(params -> "http://localhost/" + params.base()).parser((body, context) -> null)
                .build();

        QuoteValidator validator = new QuoteValidator(clock, settings.getClockSkewTolerance());
        CircuitBreakerRegistry breakers = new CircuitBreakerRegistry(3, Duration.ofSeconds(60), clock);
        SourceRegistry registry = new SourceRegistry(List.of(), List.of(), List.of(rateSource), List.of());
        FallbackCascade cascade = new FallbackCascade(fetcher, breakers, quota, Duration.ofHours(24));
        CascadeRequestFactory requests = new CascadeRequestFactory(registry, validator, snapshot, settings, clock, () -> 0L);

        service = new ExchangeRateRefreshService(
                vertx, cascade, requests, new RetryWithBackoff(vertx, 3, Duration.ofMillis(10)), Duration.ofHours(1));
    }

    @AfterEach
    void tearDown() throws Exception {
        service.stopPeriodicRefresh();
        if (vertx != null) {
            CountDownLatch latch = new CountDownLatch(1);
            vertx.close().onComplete(ar -> latch.countDown());
            latch.await(5, TimeUnit.SECONDS);
        }
        if (mocks != null) {
            mocks.close();
        }
    }

    @Test
    void refreshRates_shouldReturnLiveTable() throws Exception {
        // Given
        when(fetcher.fetch(same(rateSource), any())).thenReturn(Future.succeededFuture(eurTable()));

        // When
        RateTable table = await(service.refreshRates("eur"));

        // Then
        assertEquals(ServedFrom.LIVE, table.cacheSource());
        assertEquals("currency-api-jsdelivr", table.source());
        verify(fetcher, times(1)).fetch(same(rateSource), any());
    }

    @Test
    void refreshRates_shouldRetryTransientFailures() throws Exception {
        // Given
        when(fetcher.fetch(same(rateSource), any())).thenReturn(
                Future.failedFuture(new UpstreamStatusException("currency-api-jsdelivr", 503)),
                Future.failedFuture(new UpstreamStatusException("currency-api-jsdelivr", 503)),
                Future.succeededFuture(eurTable()));

        // When
        RateTable table = await(service.refreshRates("EUR"));

        // Then
        assertEquals(ServedFrom.LIVE, table.cacheSource());
        verify(fetcher, times(3)).fetch(same(rateSource), any());
    }

    @Test
    void refreshRates_shouldFallBackAfterLastAttempt() throws Exception {
        // Given
        when(fetcher.fetch(same(rateSource), any()))
                .thenReturn(Future.failedFuture(new UpstreamStatusException("currency-api-jsdelivr", 500)));

        // When
        RateTable table = await(service.refreshRates("EUR"));

        // Then
        assertTrue(table.fallback());
        assertEquals(ServedFrom.CONSTANT, table.cacheSource());
        assertEquals("EUR", table.base());
        // Three attempts open the breaker, so the fallback cascade does not go live again
        verify(fetcher, times(3)).fetch(same(rateSource), any());
    }

    @Test
    void refreshRates_shouldRejectMalformedBase() throws Exception {
        Throwable error = awaitFailure(service.refreshRates("EURO"));

        assertInstanceOf(IllegalArgumentException.class, error);
        verify(fetcher, never()).fetch(any(), any());
    }

    @Test
    void refreshRates_shouldRejectUnlistedBaseWithoutFetchingIt() throws Exception {
        // Given
        when(fetcher.fetch(same(rateSource), any())).thenReturn(Future.succeededFuture(
                RateTable.live("USD", Map.of("EUR", new BigDecimal("0.92")), clock.instant(), "currency-api-jsdelivr")));

        // When
        Throwable error = awaitFailure(service.refreshRates("ABC"));

        // Then
        assertInstanceOf(IllegalArgumentException.class, error);
        verify(fetcher, never()).fetch(any(), eq(SourceParams.forBase("ABC")));
    }

    @Test
    void startPeriodicRefresh_shouldPerformInitialRefresh() throws Exception {
        // Given
        when(fetcher.fetch(same(rateSource), any())).thenReturn(Future.succeededFuture(
                RateTable.live("USD", Map.of("EUR", new BigDecimal("0.92")), clock.instant(), "currency-api-jsdelivr")));

        // When
        await(service.startPeriodicRefresh());

        // Then
        verify(fetcher, times(1)).fetch(same(rateSource), any());
    }

    private RateTable eurTable() {
        return RateTable.live("EUR", Map.of("USD", new BigDecimal("1.087"), "GBP", new BigDecimal("0.85")),
                clock.instant(), "currency-api-jsdelivr");
    }
}
