package com.pricegate.adapter.out.http.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.pricegate.application.port.out.SourceDescriptor;
import com.pricegate.application.port.out.SourceDescriptor.ParseContext;
import com.pricegate.domain.model.DataKind;
import com.pricegate.domain.model.RateTable;
import com.pricegate.domain.model.SourceParams;
import com.pricegate.exception.ParseException;
import com.pricegate.exception.UnknownInstrumentException;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Exchange rate providers in priority order: the CDN-hosted currency API, its mirror, then
 * independent alternates. Each returns a table of units per one base unit.
 */
public final class RateSources {

    public static final String CURRENCY_API_CDN = "currency-api-jsdelivr";
    public static final String CURRENCY_API_MIRROR = "currency-api-pages";
    public static final String FRANKFURTER = "frankfurter";
    public static final String OPEN_ER_API = "open-er-api";
    public static final String EXCHANGERATE_HOST = "exchangerate.host";

    private static final Pattern CURRENCY_CODE = Pattern.compile("[A-Z]{3}");

    private RateSources() {
    }

    public static List<SourceDescriptor<RateTable>> all() {
        return List.of(
                currencyApi(CURRENCY_API_CDN, "https://cdn.jsdelivr.net/npm/@fawazahmed0/currency-api@latest/v1/currencies/"),
                currencyApi(CURRENCY_API_MIRROR, "https://latest.currency-api.pages.dev/v1/currencies/"),
                standard(FRANKFURTER, params -> "https://api.frankfurter.dev/v1/latest?base=" + base(params)),
                openErApi(),
                standard(EXCHANGERATE_HOST, params -> "https://api.exchangerate.host/latest?base=" + base(params))
        );
    }

    static SourceDescriptor<RateTable> currencyApi(String name, String prefix) {
        return SourceDescriptor.<RateTable>builder()
                .name(name)
                .kind(DataKind.EXCHANGE_RATE)
                .endpoint(params -> prefix + base(params).toLowerCase(Locale.ROOT) + ".json")
                .instrumentInPath(true)
                .parser(RateSources::parseCurrencyApi)
                .build();
    }

    static SourceDescriptor<RateTable> standard(String name, SourceDescriptor.EndpointBuilder endpoint) {
        return SourceDescriptor.<RateTable>builder()
                .name(name)
                .kind(DataKind.EXCHANGE_RATE)
                .endpoint(endpoint)
                .parser(RateSources::parseStandard)
                .build();
    }

    static SourceDescriptor<RateTable> openErApi() {
        return SourceDescriptor.<RateTable>builder()
                .name(OPEN_ER_API)
                .kind(DataKind.EXCHANGE_RATE)
                .endpoint(params -> "https://open.er-api.com/v6/latest/" + base(params))
                .parser(RateSources::parseOpenErApi)
                .build();
    }

    // {"date":"2024-03-01","usd":{"eur":0.92,"1inch":2.1,...}}
    static RateTable parseCurrencyApi(JsonNode body, ParseContext context) {
        String base = base(context.params());
        JsonNode rates = JsonFields.object(body, base.toLowerCase(Locale.ROOT), context);
        return RateTable.live(base, rates(rates), JsonFields.date(body, "date", context), context.source());
    }

    // {"base":"USD","date":"2024-03-01","rates":{"EUR":0.92}}
    static RateTable parseStandard(JsonNode body, ParseContext context) {
        JsonNode rates = JsonFields.object(body, "rates", context);
        String base = body.path("base").asText(base(context.params())).toUpperCase(Locale.ROOT);
        return RateTable.live(base, rates(rates), JsonFields.date(body, "date", context), context.source());
    }

    // {"result":"success","base_code":"USD","time_last_update_unix":1709251201,"rates":{"EUR":0.92}}
    static RateTable parseOpenErApi(JsonNode body, ParseContext context) {
        if ("unsupported-code".equals(body.path("error-type").asText())) {
            throw new UnknownInstrumentException(context.source(), "unsupported base " + base(context.params()));
        }
        if (body.has("result") && !"success".equals(body.path("result").asText())) {
            throw new ParseException(context.source(), "result is " + body.path("result").asText());
        }
        JsonNode rates = JsonFields.object(body, "rates", context);
        String base = body.path("base_code").asText(base(context.params())).toUpperCase(Locale.ROOT);
        return RateTable.live(base, rates(rates),
                JsonFields.epochSeconds(body, "time_last_update_unix", context), context.source());
    }

    /**
     * Numeric entries keyed by an ISO 4217 code; crypto and metal codes are dropped
     */
    private static Map<String, BigDecimal> rates(JsonNode node) {
        Map<String, BigDecimal> rates = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String code = field.getKey().toUpperCase(Locale.ROOT);
            JsonNode value = field.getValue();
            if (CURRENCY_CODE.matcher(code).matches() && value.isNumber() && Double.isFinite(value.doubleValue())) {
                rates.put(code, value.decimalValue());
            }
        }
        return rates;
    }

    private static String base(SourceParams params) {
        if (params == null || params.base() == null) {
            return "USD";
        }
        return params.base().toUpperCase(Locale.ROOT);
    }
}
