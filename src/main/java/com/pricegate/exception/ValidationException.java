package com.pricegate.exception;

import lombok.Getter;

import java.util.List;

/**
 * Value parsed fine but is not plausible
 */
@Getter
public class ValidationException extends PriceSourceException {

    private final List<String> reasons;

    public ValidationException(String source, List<String> reasons) {
        super(source, "rejected: " + String.join("; ", reasons));
        this.reasons = List.copyOf(reasons);
    }
}
