package com.pricegate.application.service;

import com.pricegate.config.FallbackConstants;
import io.vertx.core.Future;

/**
 * Accepts a base currency only when the hardcoded table or the current USD table lists it,
 * so a mistyped code never reaches the live rate sources.
 */
class CurrencyDirectory {

    private final FallbackCascade cascade;
    private final CascadeRequestFactory requests;

    CurrencyDirectory(FallbackCascade cascade, CascadeRequestFactory requests) {
        this.cascade = cascade;
        this.requests = requests;
    }

    /**
     * Normalized code, or a failed future with {@link IllegalArgumentException}
     */
    Future<String> require(String currency) {
        String code;
        try {
            code = PriceQueryService.currencyCode(currency);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
        if (FallbackConstants.USD_RATES.containsKey(code)) {
            return Future.succeededFuture(code);
        }
        return cascade.resolve(requests.rates(FallbackConstants.CURRENCY, false)).compose(table -> {
            if (table.rateOf(code).isEmpty()) {
                return Future.<String>failedFuture(new IllegalArgumentException("Unknown currency code: " + code));
            }
            return Future.succeededFuture(code);
        });
    }
}
