package com.pricegate.adapter.in.web.rate;

import com.pricegate.adapter.in.web.JsonResponses;
import com.pricegate.application.port.in.PriceQueryUseCase;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;

/**
 * GET /api/convert?amount=100&from=USD&to=SAR
 */
@RequiredArgsConstructor
public class ConvertHandler implements Handler<RoutingContext> {

    private final PriceQueryUseCase priceQueryUseCase;

    @Override
    public void handle(RoutingContext context) {
        BigDecimal amount;
        String from;
        String to;
        try {
            String rawAmount = JsonResponses.requiredParam(context, "amount");
            try {
                amount = new BigDecimal(rawAmount);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("amount must be a number, got '" + rawAmount + "'");
            }
            from = JsonResponses.requiredParam(context, "from");
            to = JsonResponses.requiredParam(context, "to");
        } catch (IllegalArgumentException e) {
            JsonResponses.fail(context, e);
            return;
        }

        priceQueryUseCase.convert(amount, from, to)
                .onSuccess(result -> JsonResponses.ok(context, new JsonObject()
                        .put("amount", amount)
                        .put("from", from.toUpperCase())
                        .put("to", to.toUpperCase())
                        .put("result", result)))
                .onFailure(error -> JsonResponses.fail(context, error));
    }
}
