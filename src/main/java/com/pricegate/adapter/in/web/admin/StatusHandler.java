package com.pricegate.adapter.in.web.admin;

import com.pricegate.adapter.in.web.JsonResponses;
import com.pricegate.application.port.in.PriceQueryUseCase;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

/**
 * GET /api/status
 */
@RequiredArgsConstructor
public class StatusHandler implements Handler<RoutingContext> {

    private final PriceQueryUseCase priceQueryUseCase;

    @Override
    public void handle(RoutingContext context) {
        priceQueryUseCase.status()
                .onSuccess(status -> JsonResponses.ok(context, status))
                .onFailure(error -> JsonResponses.fail(context, error));
    }
}
