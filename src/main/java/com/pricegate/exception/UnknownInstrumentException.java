package com.pricegate.exception;

/**
 * Upstream does not list the requested symbol or base currency.
 * A fault of the request, not of the source: it never counts against the circuit breaker.
 */
public class UnknownInstrumentException extends PriceSourceException {

    public UnknownInstrumentException(String source, String message) {
        super(source, message);
    }
}
