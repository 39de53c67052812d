package com.pricegate.application.service;

import com.pricegate.application.port.out.PriceSourceFetcher;
import com.pricegate.application.port.out.SourceDescriptor;
import com.pricegate.domain.model.CacheEntry;
import com.pricegate.domain.model.Quotation;
import com.pricegate.domain.model.ServedFrom;
import com.pricegate.exception.AllSourcesExhaustedException;
import com.pricegate.exception.CircuitOpenException;
import com.pricegate.exception.UnknownInstrumentException;
import com.pricegate.exception.ValidationException;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Obtains a value through strictly ordered tiers:
 * fresh cache, live sources, emergency cache, snapshot file, hardcoded constant.
 *
 * <p>{@link #resolve} always completes successfully. Callers detect degraded values through
 * {@code isFallback} and {@code cacheSource}.
 */
@Slf4j
public class FallbackCascade {

    static final String FILE_FALLBACK_SOURCE = "file-fallback";
    static final String CONSTANT_SOURCE = "fallback";

    private final PriceSourceFetcher fetcher;
    private final CircuitBreakerRegistry breakers;
    private final MonthlyRequestQuota quota;
    private final Duration emergencyMaxAge;

    public FallbackCascade(PriceSourceFetcher fetcher, CircuitBreakerRegistry breakers,
                           MonthlyRequestQuota quota, Duration emergencyMaxAge) {
        this.fetcher = fetcher;
        this.breakers = breakers;
        this.quota = quota;
        this.emergencyMaxAge = emergencyMaxAge;
    }

    public <T extends Quotation<T>> Future<T> resolve(CascadeRequest<T> request) {
        return Future.<Void>succeededFuture()
                .compose(v -> {
                    Optional<T> fresh = request.isRefresh() ? Optional.empty() : freshHit(request);
                    if (fresh.isPresent()) {
                        log.debug("Fresh cache hit for {}", request.getCacheKey());
                        return Future.succeededFuture(fresh.get());
                    }
                    return fetchLive(request).recover(error -> {
                        log.warn("Live tier unavailable for {}: {}", request.getCacheKey(), error.getMessage());
                        return fallBack(request);
                    });
                })
                .recover(error -> {
                    log.error("Cascade for {} failed unexpectedly, serving constant", request.getCacheKey(), error);
                    return Future.succeededFuture(constant(request));
                });
    }

    /**
     * Live tier alone: breaker check, then each source in order until one passes validation.
     * A source that does not list the requested instrument moves on without counting as a breaker failure.
     * Fails with {@link CircuitOpenException} or {@link AllSourcesExhaustedException}.
     */
    public <T extends Quotation<T>> Future<T> fetchLive(CascadeRequest<T> request) {
        CircuitBreaker breaker = breakers.forKind(request.getKind());
        if (!breaker.allowRequest()) {
            log.warn("Skipping live {} sources, circuit breaker is open", request.getKind().getValue());
            return Future.failedFuture(new CircuitOpenException(request.getKind()));
        }
        return attempt(request, breaker, 0, new ArrayList<>());
    }

    private <T extends Quotation<T>> Optional<T> freshHit(CascadeRequest<T> request) {
        return request.getCache().getFresh(request.getCacheKey())
                .map(CacheEntry::getPayload)
                .filter(value -> request.getValidator().apply(value).isValid());
    }

    private <T extends Quotation<T>> Future<T> attempt(CascadeRequest<T> request, CircuitBreaker breaker,
                                                       int index, List<Throwable> failures) {
        List<SourceDescriptor<T>> sources = request.getSources();
        if (index >= sources.size()) {
            return Future.failedFuture(new AllSourcesExhaustedException(request.getKind(), failures));
        }
        SourceDescriptor<T> source = sources.get(index);

        return admit(source).compose(admitted -> {
            if (!admitted) {
                log.info("Skipping {}: monthly quota used up", source.getName());
                return attempt(request, breaker, index + 1, failures);
            }
            log.info("Fetching {} from {} ({}/{})", request.getCacheKey(), source.getName(), index + 1, sources.size());
            return fetcher.fetch(source, request.getParams())
                    .compose(value -> checked(source, value, request))
                    .compose(value -> accept(request, breaker, source, value), error -> {
                        if (!(error instanceof UnknownInstrumentException)) {
                            breaker.recordFailure();
                        }
                        failures.add(error);
                        log.warn("Source {} failed: {}", source.getName(), error.getMessage());
                        return attempt(request, breaker, index + 1, failures);
                    });
        });
    }

    private Future<Boolean> admit(SourceDescriptor<?> source) {
        if (!source.isQuotaLimited()) {
            return Future.succeededFuture(true);
        }
        return quota.tryAcquire().recover(error -> {
            log.warn("Request counter unavailable, skipping quota-limited {}: {}", source.getName(), error.getMessage());
            return Future.succeededFuture(false);
        });
    }

    private <T extends Quotation<T>> Future<T> checked(SourceDescriptor<T> source, T value, CascadeRequest<T> request) {
        ValidationResult result = request.getValidator().apply(value);
        if (!result.isValid()) {
            return Future.failedFuture(new ValidationException(source.getName(), result.errors()));
        }
        return Future.succeededFuture(value);
    }

    private <T extends Quotation<T>> Future<T> accept(CascadeRequest<T> request, CircuitBreaker breaker,
                                                      SourceDescriptor<T> source, T value) {
        breaker.recordSuccess();
        request.getCache().set(request.getCacheKey(), value, request.getTtl());
        log.info("Accepted {} from {}", request.getCacheKey(), source.getName());
        if (request.getSnapshot() != null) {
            request.getSnapshot().saveIfAbsent(value)
                    .onSuccess(written -> {
                        if (written) {
                            log.info("Wrote fallback snapshot from {}", source.getName());
                        }
                    })
                    .onFailure(error -> log.warn("Could not write fallback snapshot: {}", error.getMessage()));
        }
        return Future.succeededFuture(value);
    }

    private <T extends Quotation<T>> Future<T> fallBack(CascadeRequest<T> request) {
        Optional<T> emergency = request.getCache().getRelaxed(request.getCacheKey(), emergencyMaxAge)
                .map(CacheEntry::getPayload)
                .filter(value -> request.getRelaxedValidator().apply(value).isValid());
        if (emergency.isPresent()) {
            log.warn("Serving emergency cache for {}", request.getCacheKey());
            T value = emergency.get();
            return Future.succeededFuture(value.servedAs(ServedFrom.EMERGENCY, value.source()));
        }
        return fromSnapshot(request).map(snapshot -> snapshot.orElseGet(() -> constant(request)));
    }

    private <T extends Quotation<T>> Future<Optional<T>> fromSnapshot(CascadeRequest<T> request) {
        if (request.getSnapshot() == null) {
            return Future.succeededFuture(Optional.empty());
        }
        return request.getSnapshot().load()
                .map(stored -> stored
                        .filter(value -> request.getRelaxedValidator().apply(value).isValid())
                        .map(value -> {
                            log.warn("Serving snapshot file for {}", request.getCacheKey());
                            return value.servedAs(ServedFrom.FILE, FILE_FALLBACK_SOURCE);
                        }))
                .recover(error -> {
                    log.warn("Snapshot file unreadable: {}", error.getMessage());
                    return Future.succeededFuture(Optional.empty());
                });
    }

    private <T extends Quotation<T>> T constant(CascadeRequest<T> request) {
        log.warn("Serving hardcoded constant for {}", request.getCacheKey());
        return request.getConstant().get().servedAs(ServedFrom.CONSTANT, CONSTANT_SOURCE);
    }
}
