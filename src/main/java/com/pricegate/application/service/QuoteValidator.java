package com.pricegate.application.service;

import com.pricegate.domain.model.MetalPrices;
import com.pricegate.domain.model.PriceQuote;
import com.pricegate.domain.model.RateTable;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Plausibility rules applied to every candidate value before it is cached or returned.
 *
 * <p>Bands catch values that parse fine but are semantically wrong: inverted rates,
 * prices per ounce reported as per gram, prices in the wrong currency.
 */
@Slf4j
public class QuoteValidator {

    private static final BigDecimal TOLERANCE = new BigDecimal("0.5");

    // Per gram, USD
    static final Band GOLD_USD = new Band(new BigDecimal("50"), new BigDecimal("120"));
    static final Band SILVER_USD = new Band(new BigDecimal("0.5"), new BigDecimal("3"));

    // Units per one USD
    static final Map<String, Band> USD_RATE_BANDS = Map.of(
            "EUR", new Band(new BigDecimal("0.8"), new BigDecimal("1.0")),
            "GBP", new Band(new BigDecimal("0.7"), new BigDecimal("0.9")),
            "INR", new Band(new BigDecimal("70"), new BigDecimal("90")),
            "PKR", new Band(new BigDecimal("250"), new BigDecimal("300")),
            "AED", new Band(new BigDecimal("3.5"), new BigDecimal("3.8")),
            "SAR", new Band(new BigDecimal("3.6"), new BigDecimal("3.9")),
            "JPY", new Band(new BigDecimal("140"), new BigDecimal("160"))
    );

    private final Clock clock;
    private final Duration skewTolerance;

    public QuoteValidator(Clock clock, Duration skewTolerance) {
        this.clock = clock;
        this.skewTolerance = skewTolerance;
    }

    /**
     * @param maxAge oldest acceptable {@code asOf}, or null for no staleness bound
     */
    public ValidationResult validatePrice(PriceQuote quote, Duration maxAge) {
        List<String> errors = new ArrayList<>();
        checkPositive("price of " + quote.symbol(), quote.value(), errors);
        checkTimestamp(quote.asOf(), maxAge, errors);
        return report(quote.source(), errors);
    }

    /**
     * Both metals must be present and positive; a partial answer is a failed answer.
     */
    public ValidationResult validateMetals(MetalPrices prices, Duration maxAge) {
        List<String> errors = new ArrayList<>();
        checkPositive("gold price", prices.gold(), errors);
        checkPositive("silver price", prices.silver(), errors);
        if (prices.currency() == null || prices.currency().isBlank()) {
            errors.add("currency is required");
        }
        if (errors.isEmpty() && "USD".equalsIgnoreCase(prices.currency())) {
            checkBand("gold price", prices.gold(), GOLD_USD, errors);
            checkBand("silver price", prices.silver(), SILVER_USD, errors);
        }
        checkTimestamp(prices.asOf(), maxAge, errors);
        return report(prices.source(), errors);
    }

    public ValidationResult validateRateTable(RateTable table, Duration maxAge) {
        List<String> errors = new ArrayList<>();
        if (table.base() == null || table.base().length() != 3) {
            errors.add("base must be a 3-character ISO 4217 code");
        }
        if (table.rates().isEmpty()) {
            errors.add("rate table is empty");
        }
        table.rates().forEach((currency, rate) -> checkPositive("rate " + currency, rate, errors));
        if (errors.isEmpty()) {
            checkRateBands(table, errors);
        }
        checkTimestamp(table.asOf(), maxAge, errors);
        return report(table.source(), errors);
    }

    /**
     * A conversion rate between two currencies is plausible if it falls in the band of that pair,
     * or if no band is known for it.
     */
    public boolean isPlausibleRate(String from, String to, BigDecimal rate) {
        if (rate == null || rate.signum() <= 0) {
            return false;
        }
        if ("USD".equalsIgnoreCase(from) && USD_RATE_BANDS.containsKey(to.toUpperCase())) {
            return USD_RATE_BANDS.get(to.toUpperCase()).contains(rate);
        }
        if ("USD".equalsIgnoreCase(to) && USD_RATE_BANDS.containsKey(from.toUpperCase())) {
            return USD_RATE_BANDS.get(from.toUpperCase()).contains(BigDecimal.ONE.divide(rate, MathContext.DECIMAL64));
        }
        return true;
    }

    public boolean isFutureDated(Instant timestamp) {
        return timestamp != null && timestamp.isAfter(clock.instant().plus(skewTolerance));
    }

    private void checkRateBands(RateTable table, List<String> errors) {
        // Normalize to USD so the bands apply to any base that also quotes USD
        Optional<BigDecimal> usd = table.rateOf("USD");
        if (usd.isEmpty()) {
            return;
        }
        USD_RATE_BANDS.forEach((currency, band) -> table.rateOf(currency).ifPresent(rate -> {
            BigDecimal perUsd = rate.divide(usd.get(), MathContext.DECIMAL64);
            if (!band.contains(perUsd)) {
                errors.add("USD/" + currency + " rate " + perUsd.stripTrailingZeros().toPlainString()
                        + " outside expected range " + band);
            }
        }));
    }

    private void checkPositive(String field, BigDecimal value, List<String> errors) {
        if (value == null) {
            errors.add(field + " is missing");
        } else if (value.signum() <= 0) {
            errors.add(field + " must be positive, got " + value.toPlainString());
        }
    }

    private void checkBand(String field, BigDecimal value, Band band, List<String> errors) {
        if (!band.contains(value)) {
            errors.add(field + " " + value.toPlainString() + " outside expected range " + band);
        }
    }

    private void checkTimestamp(Instant asOf, Duration maxAge, List<String> errors) {
        if (asOf == null) {
            errors.add("timestamp is missing");
            return;
        }
        Instant now = clock.instant();
        if (asOf.isAfter(now.plus(skewTolerance))) {
            errors.add("timestamp " + asOf + " is in the future (now " + now + ")");
        } else if (maxAge != null && Duration.between(asOf, now).compareTo(maxAge) > 0) {
            errors.add("timestamp " + asOf + " is older than " + maxAge);
        }
    }

    private ValidationResult report(String source, List<String> errors) {
        if (!errors.isEmpty()) {
            log.warn("Validation rejected value from {}: {}", source, errors);
        }
        return ValidationResult.of(errors);
    }

    /**
     * Expected range, widened by the tolerance on both sides
     */
    record Band(BigDecimal min, BigDecimal max) {

        boolean contains(BigDecimal value) {
            BigDecimal low = min.multiply(BigDecimal.ONE.subtract(TOLERANCE));
            BigDecimal high = max.multiply(BigDecimal.ONE.add(TOLERANCE));
            return value.compareTo(low) >= 0 && value.compareTo(high) <= 0;
        }

        @Override
        public String toString() {
            return "[" + min.toPlainString() + ", " + max.toPlainString() + "] ±50%";
        }
    }
}
