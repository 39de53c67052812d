package com.pricegate.exception;

/**
 * Network error or timeout talking to an upstream
 */
public class TransportException extends PriceSourceException {

    public TransportException(String source, Throwable cause) {
        super(source, "transport failure: " + cause.getMessage(), cause);
    }
}
