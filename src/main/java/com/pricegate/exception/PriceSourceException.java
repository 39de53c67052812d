package com.pricegate.exception;

import lombok.Getter;

/**
 * Failure of one upstream source. Recovered by the cascade, which moves on to the next source.
 */
@Getter
public abstract class PriceSourceException extends RuntimeException {

    private final String source;

    protected PriceSourceException(String source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    protected PriceSourceException(String source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }
}
