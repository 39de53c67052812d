package com.pricegate.exception;

/**
 * 2xx body that is not JSON or lacks the expected fields
 */
public class ParseException extends PriceSourceException {

    public ParseException(String source, String message) {
        super(source, message);
    }

    public ParseException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
