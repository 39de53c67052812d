package com.pricegate.adapter.in.web.price;

import com.pricegate.adapter.in.web.JsonResponses;
import com.pricegate.application.port.in.PriceQueryUseCase;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

/**
 * GET /api/prices/metals?currency=EUR&refresh=true
 */
@RequiredArgsConstructor
public class MetalPriceHandler implements Handler<RoutingContext> {

    private final PriceQueryUseCase priceQueryUseCase;

    @Override
    public void handle(RoutingContext context) {
        String currency = JsonResponses.param(context, "currency", "USD");
        boolean refresh = Boolean.parseBoolean(JsonResponses.param(context, "refresh", "false"));

        priceQueryUseCase.getMetalPrices(currency, refresh)
                .onSuccess(prices -> JsonResponses.ok(context, prices))
                .onFailure(error -> JsonResponses.fail(context, error));
    }
}
