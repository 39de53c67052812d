package com.pricegate.adapter.out.http.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.pricegate.application.port.out.SourceDescriptor.ParseContext;
import com.pricegate.exception.ParseException;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Defensive readers for untyped upstream bodies. A missing or non-numeric field is a parse failure.
 */
final class JsonFields {

    static final BigDecimal GRAMS_PER_TROY_OUNCE = new BigDecimal("31.1034768");

    private JsonFields() {
    }

    static BigDecimal decimal(JsonNode node, String field, ParseContext context) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            throw new ParseException(context.source(), "missing field '" + field + "'");
        }
        if (value.isNumber()) {
            if (!Double.isFinite(value.doubleValue())) {
                throw new ParseException(context.source(), "field '" + field + "' is not finite");
            }
            return value.decimalValue();
        }
        if (value.isTextual()) {
            try {
                return new BigDecimal(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new ParseException(context.source(), "field '" + field + "' is not a number: " + value.asText(), e);
            }
        }
        throw new ParseException(context.source(), "field '" + field + "' is not a number");
    }

    static JsonNode object(JsonNode node, String field, ParseContext context) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || !value.isObject()) {
            throw new ParseException(context.source(), "missing object '" + field + "'");
        }
        return value;
    }

    static JsonNode firstElement(JsonNode node, String field, ParseContext context) {
        JsonNode array = node == null ? null : node.get(field);
        if (array == null || !array.isArray() || array.isEmpty()) {
            throw new ParseException(context.source(), "missing array '" + field + "'");
        }
        return array.get(0);
    }

    static BigDecimal perGram(BigDecimal perOunce) {
        return perOunce.divide(GRAMS_PER_TROY_OUNCE, 2, RoundingMode.HALF_UP);
    }

    static BigDecimal inverse(BigDecimal value, ParseContext context) {
        if (value.signum() == 0) {
            throw new ParseException(context.source(), "cannot invert a zero rate");
        }
        return BigDecimal.ONE.divide(value, MathContext.DECIMAL64);
    }

    /**
     * Epoch seconds, or the receive time when the field is absent
     */
    static Instant epochSeconds(JsonNode node, String field, ParseContext context) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || !value.canConvertToLong()) {
            return context.receivedAt();
        }
        return Instant.ofEpochSecond(value.asLong());
    }

    static Instant epochMillis(JsonNode node, String field, ParseContext context) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || !value.canConvertToLong()) {
            return context.receivedAt();
        }
        return Instant.ofEpochMilli(value.asLong());
    }

    /**
     * {@code yyyy-MM-dd} read as UTC midnight, never later than the receive time,
     * or the receive time when the field is absent
     */
    static Instant date(JsonNode node, String field, ParseContext context) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || !value.isTextual()) {
            return context.receivedAt();
        }
        try {
            Instant midnight = LocalDate.parse(value.asText().trim()).atStartOfDay(ZoneOffset.UTC).toInstant();
            // Providers ahead of UTC publish tomorrow's date before UTC midnight
            return midnight.isAfter(context.receivedAt()) ? context.receivedAt() : midnight;
        } catch (DateTimeParseException e) {
            throw new ParseException(context.source(), "field '" + field + "' is not a date: " + value.asText(), e);
        }
    }
}
