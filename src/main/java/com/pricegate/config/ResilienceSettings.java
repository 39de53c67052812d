package com.pricegate.config;

import io.vertx.core.json.JsonObject;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Tunables of the acquisition layer, fixed for the lifetime of the process.
 * Every key has a default so an empty config is valid.
 */
@Value
@Builder
public class ResilienceSettings {

    @Builder.Default int httpPort = 8080;
    @Builder.Default Duration requestTimeout = Duration.ofSeconds(10);

    @Builder.Default Duration metalTtl = Duration.ofMinutes(5);
    @Builder.Default Duration equityTtl = Duration.ofMinutes(5);
    @Builder.Default Duration rateTtl = Duration.ofHours(1);
    @Builder.Default Duration cryptoTtl = Duration.ofMinutes(1);
    @Builder.Default Duration emergencyMaxAge = Duration.ofHours(24);

    // Oldest upstream timestamp accepted from a live source; covers weekend market closures
    @Builder.Default Duration maxUpstreamAge = Duration.ofDays(4);
    @Builder.Default Duration clockSkewTolerance = Duration.ofMinutes(5);

    @Builder.Default int breakerThreshold = 3;
    @Builder.Default Duration breakerResetTimeout = Duration.ofSeconds(60);

    @Builder.Default int retryMaxAttempts = 3;
    @Builder.Default Duration retryBaseDelay = Duration.ofSeconds(1);

    @Builder.Default String snapshotFile = "data/metal-fallback.json";
    @Builder.Default String counterFile = "data/metal-api-counter.json";
    @Builder.Default int monthlyQuota = 80;

    @Builder.Default String metalPriceApiKey = "";
    @Builder.Default String alphaVantageApiKey = "demo";

    public static ResilienceSettings defaults() {
        return ResilienceSettings.builder().build();
    }

    public static ResilienceSettings fromConfig(JsonObject config) {
        ResilienceSettings d = defaults();
        JsonObject http = section(config, "http");
        JsonObject cache = section(config, "cache");
        JsonObject validation = section(config, "validation");
        JsonObject breaker = section(config, "breaker");
        JsonObject retry = section(config, "retry");
        JsonObject files = section(config, "files");
        JsonObject quota = section(config, "quota");
        JsonObject providers = section(config, "providers");

        return ResilienceSettings.builder()
                .httpPort(http.getInteger("port", d.httpPort))
                .requestTimeout(Duration.ofMillis(http.getLong("timeoutMillis", d.requestTimeout.toMillis())))
                .metalTtl(Duration.ofSeconds(cache.getLong("metalTtlSeconds", d.metalTtl.toSeconds())))
                .equityTtl(Duration.ofSeconds(cache.getLong("equityTtlSeconds", d.equityTtl.toSeconds())))
                .rateTtl(Duration.ofSeconds(cache.getLong("rateTtlSeconds", d.rateTtl.toSeconds())))
                .cryptoTtl(Duration.ofSeconds(cache.getLong("cryptoTtlSeconds", d.cryptoTtl.toSeconds())))
                .emergencyMaxAge(Duration.ofHours(cache.getLong("emergencyMaxAgeHours", d.emergencyMaxAge.toHours())))
                .maxUpstreamAge(Duration.ofHours(validation.getLong("maxUpstreamAgeHours", d.maxUpstreamAge.toHours())))
                .clockSkewTolerance(Duration.ofSeconds(
                        validation.getLong("clockSkewToleranceSeconds", d.clockSkewTolerance.toSeconds())))
                .breakerThreshold(breaker.getInteger("threshold", d.breakerThreshold))
                .breakerResetTimeout(Duration.ofSeconds(
                        breaker.getLong("resetTimeoutSeconds", d.breakerResetTimeout.toSeconds())))
                .retryMaxAttempts(retry.getInteger("maxAttempts", d.retryMaxAttempts))
                .retryBaseDelay(Duration.ofMillis(retry.getLong("baseDelayMillis", d.retryBaseDelay.toMillis())))
                .snapshotFile(files.getString("snapshot", d.snapshotFile))
                .counterFile(files.getString("counter", d.counterFile))
                .monthlyQuota(quota.getInteger("monthlyLimit", d.monthlyQuota))
                .metalPriceApiKey(providers.getString("metalPriceApiKey", d.metalPriceApiKey))
                .alphaVantageApiKey(providers.getString("alphaVantageApiKey", d.alphaVantageApiKey))
                .build();
    }

    private static JsonObject section(JsonObject config, String name) {
        JsonObject section = config == null ? null : config.getJsonObject(name);
        return section == null ? new JsonObject() : section;
    }
}
