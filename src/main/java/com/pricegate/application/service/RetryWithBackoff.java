package com.pricegate.application.service;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Retries one logical call with exponential backoff: {@code baseDelay * 2^attempt} between attempts.
 * Independent of the circuit breaker, which decides whether an attempt goes live at all.
 */
@Slf4j
public class RetryWithBackoff {

    private final Vertx vertx;
    private final int maxAttempts;
    private final Duration baseDelay;

    public RetryWithBackoff(Vertx vertx, int maxAttempts, Duration baseDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.vertx = vertx;
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
    }

    public <T> Future<T> execute(String operation, Supplier<Future<T>> action) {
        return attempt(operation, action, 0);
    }

    long delayMillis(int attempt) {
        return Math.max(1L, baseDelay.toMillis() << attempt);
    }

    private <T> Future<T> attempt(String operation, Supplier<Future<T>> action, int attempt) {
        return Future.<Void>succeededFuture()
                .compose(v -> action.get())
                .recover(error -> {
                    if (attempt + 1 >= maxAttempts) {
                        log.warn("{} failed after {} attempts: {}", operation, maxAttempts, error.getMessage());
                        return Future.failedFuture(error);
                    }
                    long delay = delayMillis(attempt);
                    log.warn("{} failed ({}), retrying in {}ms ({}/{})",
                            operation, error.getMessage(), delay, attempt + 2, maxAttempts);
                    Promise<T> promise = Promise.promise();
                    vertx.setTimer(delay, id -> attempt(operation, action, attempt + 1).onComplete(promise));
                    return promise.future();
                });
    }
}
