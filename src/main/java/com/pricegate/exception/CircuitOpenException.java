package com.pricegate.exception;

import com.pricegate.domain.model.DataKind;
import lombok.Getter;

/**
 * Live requests for a data kind are short-circuited while its breaker is open
 */
@Getter
public class CircuitOpenException extends RuntimeException {

    private final DataKind kind;

    public CircuitOpenException(DataKind kind) {
        super("Circuit breaker open for " + kind.getValue() + " sources");
        this.kind = kind;
    }
}
