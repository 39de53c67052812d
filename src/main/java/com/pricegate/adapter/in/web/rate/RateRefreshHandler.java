package com.pricegate.adapter.in.web.rate;

import com.pricegate.adapter.in.web.JsonResponses;
import com.pricegate.application.port.in.ExchangeRateRefreshUseCase;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

/**
 * POST /api/rates/refresh?base=EUR, issued when the user switches currency
 */
@RequiredArgsConstructor
public class RateRefreshHandler implements Handler<RoutingContext> {

    private final ExchangeRateRefreshUseCase refreshUseCase;

    @Override
    public void handle(RoutingContext context) {
        refreshUseCase.refreshRates(JsonResponses.param(context, "base", "USD"))
                .onSuccess(table -> JsonResponses.ok(context, table))
                .onFailure(error -> JsonResponses.fail(context, error));
    }
}
