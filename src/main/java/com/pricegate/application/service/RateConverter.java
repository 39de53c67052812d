package com.pricegate.application.service;

import com.pricegate.config.FallbackConstants;
import com.pricegate.domain.model.RateTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Optional;

/**
 * Converts amounts through a base-normalized rate table: {@code amount / rates[from] * rates[to]}.
 * Falls back to hardcoded pairs, and finally returns the amount unconverted.
 */
@Slf4j
@RequiredArgsConstructor
public class RateConverter {

    private final QuoteValidator validator;

    public BigDecimal convert(BigDecimal amount, String from, String to, RateTable table) {
        return convertDetailed(amount, from, to, table).amount();
    }

    public Conversion convertDetailed(BigDecimal amount, String from, String to, RateTable table) {
        if (from.equalsIgnoreCase(to)) {
            return new Conversion(amount, ConversionPath.IDENTITY);
        }

        Optional<BigDecimal> tableRate = rateFromTable(from, to, table);
        if (tableRate.isPresent()) {
            return new Conversion(amount.multiply(tableRate.get(), MathContext.DECIMAL64),
                    table.fallback() ? ConversionPath.ESTIMATED_TABLE : ConversionPath.TABLE);
        }

        Optional<BigDecimal> pairRate = FallbackConstants.bilateralRate(from, to);
        if (pairRate.isPresent()) {
            log.warn("Using hardcoded {}->{} rate {}", from, to, pairRate.get());
            return new Conversion(amount.multiply(pairRate.get(), MathContext.DECIMAL64), ConversionPath.HARDCODED_PAIR);
        }

        log.warn("Cannot convert {} {} to {}: no rate available, returning amount unconverted", amount, from, to);
        return new Conversion(amount, ConversionPath.UNCONVERTED);
    }

    private Optional<BigDecimal> rateFromTable(String from, String to, RateTable table) {
        if (table == null) {
            return Optional.empty();
        }
        Optional<BigDecimal> fromRate = table.rateOf(from).filter(rate -> rate.signum() > 0);
        Optional<BigDecimal> toRate = table.rateOf(to).filter(rate -> rate.signum() > 0);
        if (fromRate.isEmpty() || toRate.isEmpty()) {
            log.debug("Rate table {} has no {}->{} pair", table.base(), from, to);
            return Optional.empty();
        }
        BigDecimal rate = toRate.get().divide(fromRate.get(), MathContext.DECIMAL64);
        if (!validator.isPlausibleRate(from, to, rate)) {
            log.warn("Rate table {} from {} gives implausible {}->{} rate {}", table.base(), table.source(), from, to, rate);
            return Optional.empty();
        }
        return Optional.of(rate);
    }

    public enum ConversionPath {
        IDENTITY,
        TABLE,
        ESTIMATED_TABLE,
        HARDCODED_PAIR,
        UNCONVERTED;

        /**
         * True when the converted amount rests on an estimated rate
         */
        public boolean isEstimate() {
            return this == ESTIMATED_TABLE || this == HARDCODED_PAIR || this == UNCONVERTED;
        }
    }

    public record Conversion(BigDecimal amount, ConversionPath path) {
    }
}
