package com.pricegate.adapter.in.web.price;

import com.pricegate.adapter.in.web.JsonResponses;
import com.pricegate.application.port.in.PriceQueryUseCase;
import com.pricegate.domain.model.DataKind;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

/**
 * GET /api/prices?kind=metal&symbol=gold&currency=EUR
 */
@RequiredArgsConstructor
public class PriceHandler implements Handler<RoutingContext> {

    private final PriceQueryUseCase priceQueryUseCase;

    @Override
    public void handle(RoutingContext context) {
        DataKind kind;
        String symbol;
        try {
            String kindParam = JsonResponses.requiredParam(context, "kind");
            if (!DataKind.isValid(kindParam)) {
                throw new IllegalArgumentException("Unknown kind '" + kindParam + "', expected equity, metal, crypto or exchange-rate");
            }
            kind = DataKind.fromValue(kindParam);
            symbol = JsonResponses.requiredParam(context, "symbol");
        } catch (IllegalArgumentException e) {
            JsonResponses.fail(context, e);
            return;
        }

        priceQueryUseCase.getPrice(kind, symbol, JsonResponses.param(context, "currency", "USD"))
                .onSuccess(quote -> JsonResponses.ok(context, quote))
                .onFailure(error -> JsonResponses.fail(context, error));
    }
}
