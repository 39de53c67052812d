package com.pricegate.domain.model;

/**
 * Precious metals quoted per gram
 */
public enum Metal {
    GOLD("gold"),
    SILVER("silver");

    private final String value;

    Metal(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Metal fromValue(String value) {
        for (Metal metal : values()) {
            if (metal.value.equalsIgnoreCase(value)) {
                return metal;
            }
        }
        throw new IllegalArgumentException("Unknown metal: " + value);
    }
}
