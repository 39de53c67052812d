package com.pricegate.application.service;

import com.pricegate.application.port.out.SnapshotRepository;
import com.pricegate.application.port.out.SourceDescriptor;
import com.pricegate.domain.model.DataKind;
import com.pricegate.domain.model.Quotation;
import com.pricegate.domain.model.SourceParams;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Everything one cascade invocation needs for one data kind
 */
@Value
@Builder
public class CascadeRequest<T extends Quotation<T>> {
    DataKind kind;
    String cacheKey;
    SourceParams params;
    List<SourceDescriptor<T>> sources;  // already ordered for this call
    CacheStore<T> cache;
    Duration ttl;

    // Live and fresh-cache tiers
    Function<T, ValidationResult> validator;

    // Emergency and file tiers: no staleness bound, future dates still rejected
    Function<T, ValidationResult> relaxedValidator;

    SnapshotRepository<T> snapshot;  // null when the kind has no durable floor
    Supplier<T> constant;
    boolean refresh;
}
