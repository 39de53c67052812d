package com.pricegate.exception;

import lombok.Getter;

/**
 * Upstream answered with a non-2xx status
 */
@Getter
public class UpstreamStatusException extends PriceSourceException {

    private final int status;

    public UpstreamStatusException(String source, int status) {
        super(source, "returned status " + status);
        this.status = status;
    }
}
