package com.pricegate.config;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Map;
import java.util.Optional;

/**
 * Last-known-good values served when every live and cached tier is unavailable
 */
public final class FallbackConstants {

    public static final String CURRENCY = "USD";

    public static final BigDecimal GOLD_USD_PER_GRAM = new BigDecimal("93.98");
    public static final BigDecimal SILVER_USD_PER_GRAM = new BigDecimal("1.02");

    /**
     * Units per one USD
     */
    public static final Map<String, BigDecimal> USD_RATES = Map.ofEntries(
            Map.entry("USD", new BigDecimal("1")),
            Map.entry("EUR", new BigDecimal("0.92")),
            Map.entry("GBP", new BigDecimal("0.78")),
            Map.entry("JPY", new BigDecimal("150.5")),
            Map.entry("CAD", new BigDecimal("1.35")),
            Map.entry("AUD", new BigDecimal("1.52")),
            Map.entry("INR", new BigDecimal("83.15")),
            Map.entry("PKR", new BigDecimal("278.5")),
            Map.entry("AED", new BigDecimal("3.67")),
            Map.entry("SAR", new BigDecimal("3.75")),
            Map.entry("MYR", new BigDecimal("4.65")),
            Map.entry("SGD", new BigDecimal("1.35")),
            Map.entry("BDT", new BigDecimal("110.5")),
            Map.entry("EGP", new BigDecimal("30.9")),
            Map.entry("IDR", new BigDecimal("15600")),
            Map.entry("KWD", new BigDecimal("0.31")),
            Map.entry("NGN", new BigDecimal("1550")),
            Map.entry("QAR", new BigDecimal("3.64")),
            Map.entry("ZAR", new BigDecimal("18.5")),
            Map.entry("RUB", new BigDecimal("91.5"))
    );

    // Direct pairs only, the reverse direction is derived
    private static final Map<String, BigDecimal> BILATERAL_RATES = Map.of(
            "USD:EUR", new BigDecimal("0.92"),
            "USD:GBP", new BigDecimal("0.78"),
            "USD:SAR", new BigDecimal("3.75"),
            "USD:PKR", new BigDecimal("278.5"),
            "USD:AED", new BigDecimal("3.67"),
            "USD:INR", new BigDecimal("83.15"),
            "USD:RUB", new BigDecimal("91.5")
    );

    private FallbackConstants() {
    }

    /**
     * Hardcoded rate for a high-traffic pair, in either direction
     */
    public static Optional<BigDecimal> bilateralRate(String from, String to) {
        String f = from.toUpperCase();
        String t = to.toUpperCase();
        BigDecimal direct = BILATERAL_RATES.get(f + ":" + t);
        if (direct != null) {
            return Optional.of(direct);
        }
        BigDecimal inverse = BILATERAL_RATES.get(t + ":" + f);
        if (inverse != null) {
            return Optional.of(BigDecimal.ONE.divide(inverse, MathContext.DECIMAL64));
        }
        return Optional.empty();
    }
}
