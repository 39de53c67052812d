package com.pricegate.domain.model;

/**
 * Kind of market data obtained from upstream providers.
 * Each kind is one upstream class with its own circuit breaker.
 */
public enum DataKind {
    EQUITY("equity", true),
    METAL("metal", true),
    EXCHANGE_RATE("exchange-rate", false),
    CRYPTO("crypto", false);

    private final String value;
    private final boolean randomizedOrder;

    DataKind(String value, boolean randomizedOrder) {
        this.value = value;
        this.randomizedOrder = randomizedOrder;
    }

    public String getValue() {
        return value;
    }

    /**
     * Equivalent free-tier providers are shuffled per call; tiered providers keep priority order.
     */
    public boolean isRandomizedOrder() {
        return randomizedOrder;
    }

    public static DataKind fromValue(String value) {
        for (DataKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown data kind: " + value);
    }

    public static boolean isValid(String value) {
        for (DataKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
