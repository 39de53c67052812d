package com.pricegate.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tier of the fallback cascade that produced a value
 */
public enum ServedFrom {
    LIVE("live", false),
    EMERGENCY("emergency", true),
    FILE("file", true),
    CONSTANT("constant", true);

    private final String value;
    private final boolean fallback;

    ServedFrom(String value, boolean fallback) {
        this.value = value;
        this.fallback = fallback;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isFallback() {
        return fallback;
    }

    @JsonCreator
    public static ServedFrom fromValue(String value) {
        for (ServedFrom tier : values()) {
            if (tier.value.equalsIgnoreCase(value)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown cache source: " + value);
    }
}
