package com.pricegate.adapter.in.web.price;

import com.pricegate.adapter.in.web.JsonResponses;
import com.pricegate.application.port.in.PriceQueryUseCase;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * GET /api/prices/metals/batch?currencies=USD,EUR,PKR
 */
@RequiredArgsConstructor
public class MetalBatchHandler implements Handler<RoutingContext> {

    private final PriceQueryUseCase priceQueryUseCase;

    @Override
    public void handle(RoutingContext context) {
        List<String> currencies;
        try {
            currencies = Arrays.stream(JsonResponses.requiredParam(context, "currencies").split(","))
                    .map(String::trim)
                    .filter(code -> !code.isEmpty())
                    .distinct()
                    .collect(Collectors.toList());
        } catch (IllegalArgumentException e) {
            JsonResponses.fail(context, e);
            return;
        }

        priceQueryUseCase.getMetalPrices(currencies)
                .onSuccess(prices -> JsonResponses.ok(context, prices))
                .onFailure(error -> JsonResponses.fail(context, error));
    }
}
