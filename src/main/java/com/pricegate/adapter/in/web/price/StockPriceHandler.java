package com.pricegate.adapter.in.web.price;

import com.pricegate.adapter.in.web.JsonResponses;
import com.pricegate.application.port.in.PriceQueryUseCase;
import com.pricegate.domain.model.DataKind;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

/**
 * GET /api/prices/stocks?symbol=AAPL&currency=USD
 */
@RequiredArgsConstructor
public class StockPriceHandler implements Handler<RoutingContext> {

    private final PriceQueryUseCase priceQueryUseCase;

    @Override
    public void handle(RoutingContext context) {
        String symbol;
        try {
            symbol = JsonResponses.requiredParam(context, "symbol");
        } catch (IllegalArgumentException e) {
            JsonResponses.fail(context, e);
            return;
        }

        priceQueryUseCase.getPrice(DataKind.EQUITY, symbol, JsonResponses.param(context, "currency", "USD"))
                .onSuccess(quote -> JsonResponses.ok(context, quote))
                .onFailure(error -> JsonResponses.fail(context, error));
    }
}
