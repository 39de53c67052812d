package com.pricegate.adapter.out.http.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.pricegate.application.port.out.SourceDescriptor;
import com.pricegate.application.port.out.SourceDescriptor.ParseContext;
import com.pricegate.domain.model.DataKind;
import com.pricegate.domain.model.MetalPrices;
import com.pricegate.exception.ParseException;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;

import static com.pricegate.adapter.out.http.source.JsonFields.decimal;
import static com.pricegate.adapter.out.http.source.JsonFields.perGram;

/**
 * Metal spot price providers. All quote USD per troy ounce; values are normalized to USD per gram.
 */
public final class MetalSources {

    public static final String FRANKFURTER = "frankfurter";
    public static final String GOLDPRICE = "goldprice";
    public static final String METALS_LIVE = "metals.live";
    public static final String METALPRICEAPI = "metalpriceapi";

    private static final String USD = "USD";

    private MetalSources() {
    }

    /**
     * Equivalent free providers first, the quota-limited one last.
     * Without an api key the quota-limited provider is not registered.
     */
    public static List<SourceDescriptor<MetalPrices>> all(String metalPriceApiKey) {
        List<SourceDescriptor<MetalPrices>> sources = new ArrayList<>(List.of(frankfurter(), goldPrice(), metalsLive()));
        if (metalPriceApiKey != null && !metalPriceApiKey.isBlank()) {
            sources.add(metalPriceApi(metalPriceApiKey));
        }
        return sources;
    }

    static SourceDescriptor<MetalPrices> frankfurter() {
        return SourceDescriptor.<MetalPrices>builder()
                .name(FRANKFURTER)
                .kind(DataKind.METAL)
                .endpoint(params -> "https://api.frankfurter.app/latest?from=XAU&to=USD,XAG")
                .parser(MetalSources::parseFrankfurter)
                .build();
    }

    static SourceDescriptor<MetalPrices> goldPrice() {
        return SourceDescriptor.<MetalPrices>builder()
                .name(GOLDPRICE)
                .kind(DataKind.METAL)
                .endpoint(params -> "https://data-asg.goldprice.org/dbXRates/USD")
                .header("User-Agent", "Mozilla/5.0")
                .parser(MetalSources::parseGoldPrice)
                .build();
    }

    static SourceDescriptor<MetalPrices> metalsLive() {
        return SourceDescriptor.<MetalPrices>builder()
                .name(METALS_LIVE)
                .kind(DataKind.METAL)
                .endpoint(params -> "https://api.metals.live/v1/spot/gold,silver")
                .parser(MetalSources::parseMetalsLive)
                .build();
    }

    static SourceDescriptor<MetalPrices> metalPriceApi(String apiKey) {
        return SourceDescriptor.<MetalPrices>builder()
                .name(METALPRICEAPI)
                .kind(DataKind.METAL)
                .endpoint(params -> "https://api.metalpriceapi.com/v1/latest?api_key=" + apiKey
                        + "&base=USD&currencies=XAU,XAG")
                .parser(MetalSources::parseMetalPriceApi)
                .quotaLimited(true)
                .build();
    }

    // {"base":"XAU","date":"2024-03-01","rates":{"USD":2044.1,"XAG":89.2}}
    static MetalPrices parseFrankfurter(JsonNode body, ParseContext context) {
        JsonNode rates = JsonFields.object(body, "rates", context);
        BigDecimal goldOunce = decimal(rates, "USD", context);
        BigDecimal silverPerGold = decimal(rates, "XAG", context);
        if (silverPerGold.signum() <= 0) {
            throw new ParseException(context.source(), "XAG rate must be positive");
        }
        BigDecimal silverOunce = goldOunce.divide(silverPerGold, MathContext.DECIMAL64);
        return MetalPrices.live(perGram(goldOunce), perGram(silverOunce), USD,
                JsonFields.date(body, "date", context), context.source());
    }

    // {"ts":1709290000000,"items":[{"curr":"USD","xauPrice":2044.1,"xagPrice":22.9}]}
    static MetalPrices parseGoldPrice(JsonNode body, ParseContext context) {
        JsonNode item = JsonFields.firstElement(body, "items", context);
        return MetalPrices.live(perGram(decimal(item, "xauPrice", context)), perGram(decimal(item, "xagPrice", context)),
                USD, JsonFields.epochMillis(body, "ts", context), context.source());
    }

    // [{"metal":"gold","price":2044.1},{"metal":"silver","price":22.9}]
    static MetalPrices parseMetalsLive(JsonNode body, ParseContext context) {
        if (body == null || !body.isArray()) {
            throw new ParseException(context.source(), "expected an array of spot prices");
        }
        BigDecimal gold = null;
        BigDecimal silver = null;
        for (JsonNode entry : body) {
            String metal = entry.path("metal").asText("");
            if ("gold".equalsIgnoreCase(metal)) {
                gold = decimal(entry, "price", context);
            } else if ("silver".equalsIgnoreCase(metal)) {
                silver = decimal(entry, "price", context);
            }
        }
        if (gold == null || silver == null) {
            throw new ParseException(context.source(), "response lacks " + (gold == null ? "gold" : "silver"));
        }
        return MetalPrices.live(perGram(gold), perGram(silver), USD, context.receivedAt(), context.source());
    }

    // {"success":true,"base":"USD","timestamp":1709290000,"rates":{"XAU":0.000489,"XAG":0.0437}}
    static MetalPrices parseMetalPriceApi(JsonNode body, ParseContext context) {
        JsonNode rates = JsonFields.object(body, "rates", context);
        BigDecimal goldOunce = JsonFields.inverse(decimal(rates, "XAU", context), context);
        BigDecimal silverOunce = JsonFields.inverse(decimal(rates, "XAG", context), context);
        return MetalPrices.live(perGram(goldOunce), perGram(silverOunce), USD,
                JsonFields.epochSeconds(body, "timestamp", context), context.source());
    }
}
