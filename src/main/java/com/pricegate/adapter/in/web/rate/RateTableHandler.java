package com.pricegate.adapter.in.web.rate;

import com.pricegate.adapter.in.web.JsonResponses;
import com.pricegate.application.port.in.PriceQueryUseCase;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

/**
 * GET /api/rates?base=USD
 */
@RequiredArgsConstructor
public class RateTableHandler implements Handler<RoutingContext> {

    private final PriceQueryUseCase priceQueryUseCase;

    @Override
    public void handle(RoutingContext context) {
        priceQueryUseCase.getRateTable(JsonResponses.param(context, "base", "USD"))
                .onSuccess(table -> JsonResponses.ok(context, table))
                .onFailure(error -> JsonResponses.fail(context, error));
    }
}
