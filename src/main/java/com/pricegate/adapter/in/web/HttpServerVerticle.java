package com.pricegate.adapter.in.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricegate.adapter.out.http.WebClientSourceFetcher;
import com.pricegate.adapter.out.http.source.CryptoSources;
import com.pricegate.adapter.out.http.source.EquitySources;
import com.pricegate.adapter.out.http.source.MetalSources;
import com.pricegate.adapter.out.http.source.RateSources;
import com.pricegate.adapter.out.persistence.FileRequestCounterRepository;
import com.pricegate.adapter.out.persistence.FileSnapshotRepository;
import com.pricegate.application.port.in.ExchangeRateRefreshUseCase;
import com.pricegate.application.port.in.PriceQueryUseCase;
import com.pricegate.application.port.out.PriceSourceFetcher;
import com.pricegate.application.port.out.SnapshotRepository;
import com.pricegate.application.service.CascadeRequestFactory;
import com.pricegate.application.service.CircuitBreakerRegistry;
import com.pricegate.application.service.ExchangeRateRefreshService;
import com.pricegate.application.service.FallbackCascade;
import com.pricegate.application.service.MonthlyRequestQuota;
import com.pricegate.application.service.PriceQueryService;
import com.pricegate.application.service.QuoteValidator;
import com.pricegate.application.service.RateConverter;
import com.pricegate.application.service.RetryWithBackoff;
import com.pricegate.application.service.SourceRegistry;
import com.pricegate.config.ResilienceSettings;
import com.pricegate.domain.model.DataKind;
import com.pricegate.domain.model.MetalPrices;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.ext.web.handler.LoggerHandler;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * HTTP Server Verticle - handles all HTTP requests
 * Infrastructure component that wires up the hexagonal architecture
 */
@Slf4j
public class HttpServerVerticle extends AbstractVerticle {

    private ResilienceSettings settings;
    private WebClient webClient;
    private PriceQueryUseCase priceQueryUseCase;
    private ExchangeRateRefreshUseCase exchangeRateRefreshUseCase;

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting HTTP Server Verticle...");

        settings = ResilienceSettings.fromConfig(config());
        initializeServices();

        startHttpServer()
                .onSuccess(v -> {
                    log.info("HTTP Server Verticle started successfully on port {}", settings.getHttpPort());
                    // Warm the USD table in the background; the cascade serves constants until it lands
                    exchangeRateRefreshUseCase.startPeriodicRefresh()
                            .onFailure(error -> log.error("Failed to start exchange rate refresh", error));
                    startPromise.complete();
                })
                .onFailure(error -> {
                    log.error("Failed to start HTTP Server Verticle", error);
                    startPromise.fail(error);
                });
    }

    @Override
    public void stop() {
        if (exchangeRateRefreshUseCase != null) {
            exchangeRateRefreshUseCase.stopPeriodicRefresh();
        }
        if (webClient != null) {
            webClient.close();
        }
        log.info("HTTP Server Verticle stopped");
    }

    private void initializeServices() {
        Clock clock = Clock.systemUTC();

        // Output ports (adapters)
        webClient = WebClient.create(vertx, new WebClientOptions()
                .setUserAgent("price-gateway/1.0")
                .setFollowRedirects(true));
        PriceSourceFetcher fetcher = new WebClientSourceFetcher(
                webClient, new ObjectMapper(), settings.getRequestTimeout(), clock);
        SnapshotRepository<MetalPrices> metalSnapshot = new FileSnapshotRepository<>(
                vertx.fileSystem(), settings.getSnapshotFile(), MetalPrices.class);
        MonthlyRequestQuota quota = new MonthlyRequestQuota(
                new FileRequestCounterRepository(vertx.fileSystem(), settings.getCounterFile()),
                settings.getMonthlyQuota(),
                clock);

        SourceRegistry registry = new SourceRegistry(
                MetalSources.all(settings.getMetalPriceApiKey()),
                EquitySources.all(settings.getAlphaVantageApiKey()),
                RateSources.all(),
                CryptoSources.all());

        // Application services (use cases)
        QuoteValidator validator = new QuoteValidator(clock, settings.getClockSkewTolerance());
        CircuitBreakerRegistry breakers = new CircuitBreakerRegistry(
                settings.getBreakerThreshold(), settings.getBreakerResetTimeout(), clock);
        FallbackCascade cascade = new FallbackCascade(fetcher, breakers, quota, settings.getEmergencyMaxAge());
        CascadeRequestFactory requests = new CascadeRequestFactory(
                registry, validator, metalSnapshot, settings, clock, () -> ThreadLocalRandom.current().nextLong());

        priceQueryUseCase = new PriceQueryService(
                cascade, requests, new RateConverter(validator), breakers, quota, metalSnapshot);
        exchangeRateRefreshUseCase = new ExchangeRateRefreshService(
                vertx,
                cascade,
                requests,
                new RetryWithBackoff(vertx, settings.getRetryMaxAttempts(), settings.getRetryBaseDelay()),
                settings.getRateTtl());

        log.info("Services wired up ({} metal, {} equity, {} rate, {} crypto sources)",
                registry.size(DataKind.METAL), registry.size(DataKind.EQUITY), registry.size(DataKind.EXCHANGE_RATE),
                registry.size(DataKind.CRYPTO));
    }

    private Future<Void> startHttpServer() {
        Router router = Router.router(vertx);

        // Global handlers
        router.route().handler(LoggerHandler.create());

        new WebRouter(router, priceQueryUseCase, exchangeRateRefreshUseCase).setupRoutes();

        // Default route - 404
        router.route().handler(ctx -> ctx.response()
                .setStatusCode(404)
                .putHeader("Content-Type", "application/json")
                .end(new JsonObject()
                        .put("status", "error")
                        .put("message", "Endpoint not found")
                        .encode()));

        int port = settings.getHttpPort();

        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(port)
                .onSuccess(server -> log.info("HTTP server listening on port {}", server.actualPort()))
                .mapEmpty();
    }
}
