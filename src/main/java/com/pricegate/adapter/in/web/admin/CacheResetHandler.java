package com.pricegate.adapter.in.web.admin;

import com.pricegate.adapter.in.web.JsonResponses;
import com.pricegate.application.port.in.PriceQueryUseCase;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

/**
 * POST /api/cache/reset
 */
@RequiredArgsConstructor
public class CacheResetHandler implements Handler<RoutingContext> {

    private final PriceQueryUseCase priceQueryUseCase;

    @Override
    public void handle(RoutingContext context) {
        priceQueryUseCase.resetCaches();
        JsonResponses.ok(context, new JsonObject()
                .put("status", "OK")
                .put("message", "Caches cleared"));
    }
}
