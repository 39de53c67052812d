package com.pricegate.domain.model;

import java.util.Map;

/**
 * Health of the acquisition layer: breaker per data kind, quota usage, durable floor presence
 */
public record GatewayStatus(
        Map<DataKind, CircuitBreakerState> breakers,
        RequestCounter quotaCounter,
        int monthlyQuota,
        boolean snapshotPresent,
        Map<String, Integer> cacheSizes
) {
}
