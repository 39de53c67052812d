package com.pricegate.adapter.in.web;

import com.pricegate.adapter.in.web.admin.CacheResetHandler;
import com.pricegate.adapter.in.web.admin.StatusHandler;
import com.pricegate.adapter.in.web.price.CryptoPriceHandler;
import com.pricegate.adapter.in.web.price.MetalBatchHandler;
import com.pricegate.adapter.in.web.price.MetalPriceHandler;
import com.pricegate.adapter.in.web.price.PriceHandler;
import com.pricegate.adapter.in.web.price.StockPriceHandler;
import com.pricegate.adapter.in.web.rate.ConvertHandler;
import com.pricegate.adapter.in.web.rate.RateRefreshHandler;
import com.pricegate.adapter.in.web.rate.RateTableHandler;
import com.pricegate.application.port.in.ExchangeRateRefreshUseCase;
import com.pricegate.application.port.in.PriceQueryUseCase;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import lombok.RequiredArgsConstructor;

/**
 * Router configuration for price and rate endpoints
 */
@RequiredArgsConstructor
public class WebRouter {

    private final Router router;
    private final PriceQueryUseCase priceQueryUseCase;
    private final ExchangeRateRefreshUseCase refreshUseCase;

    public void setupRoutes() {
        // CORS headers
        router.route().handler(ctx -> {
            ctx.response()
                    .putHeader("Access-Control-Allow-Origin", "*")
                    .putHeader("Access-Control-Allow-Methods", "GET, POST, OPTIONS")
                    .putHeader("Access-Control-Allow-Headers", "Content-Type, Authorization, X-Requested-With");
            ctx.next();
        });

        router.options("/api/*").handler(ctx -> ctx.response().setStatusCode(204).end());

        // Prices
        router.get("/api/prices/metals/batch").handler(new MetalBatchHandler(priceQueryUseCase));
        router.get("/api/prices/metals").handler(new MetalPriceHandler(priceQueryUseCase));
        router.get("/api/prices/stocks").handler(new StockPriceHandler(priceQueryUseCase));
        router.get("/api/prices/crypto").handler(new CryptoPriceHandler(priceQueryUseCase));
        router.get("/api/prices").handler(new PriceHandler(priceQueryUseCase));

        // Rates
        router.get("/api/rates").handler(new RateTableHandler(priceQueryUseCase));
        router.post("/api/rates/refresh").handler(new RateRefreshHandler(refreshUseCase));
        router.get("/api/convert").handler(new ConvertHandler(priceQueryUseCase));

        // Operations
        router.get("/api/status").handler(new StatusHandler(priceQueryUseCase));
        router.post("/api/cache/reset").handler(new CacheResetHandler(priceQueryUseCase));

        router.get("/health")
                .handler(ctx -> JsonResponses.ok(ctx, new JsonObject()
                        .put("status", "UP")
                        .put("service", "price-gateway")));
    }
}
