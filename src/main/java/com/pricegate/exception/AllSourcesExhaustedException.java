package com.pricegate.exception;

import com.pricegate.domain.model.DataKind;
import lombok.Getter;

import java.util.List;

/**
 * Every registered source of a data kind failed. Never leaves the cascade.
 */
@Getter
public class AllSourcesExhaustedException extends RuntimeException {

    private final DataKind kind;
    private final List<Throwable> failures;

    public AllSourcesExhaustedException(DataKind kind, List<Throwable> failures) {
        super("All " + kind.getValue() + " sources failed (" + failures.size() + " attempted)");
        this.kind = kind;
        this.failures = List.copyOf(failures);
        failures.forEach(this::addSuppressed);
    }
}
