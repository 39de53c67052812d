package com.pricegate.adapter.out.http.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.pricegate.application.port.out.SourceDescriptor;
import com.pricegate.application.port.out.SourceDescriptor.ParseContext;
import com.pricegate.domain.model.DataKind;
import com.pricegate.domain.model.PriceQuote;
import com.pricegate.domain.model.SourceParams;
import com.pricegate.exception.ParseException;
import com.pricegate.exception.UnknownInstrumentException;

import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Equity price providers, all quoting USD
 */
public final class EquitySources {

    public static final String YAHOO = "yahoo-finance";
    public static final String ALPHA_VANTAGE = "alpha-vantage";

    private static final String USD = "USD";

    private EquitySources() {
    }

    public static List<SourceDescriptor<PriceQuote>> all(String alphaVantageApiKey) {
        return List.of(yahoo(), alphaVantage(alphaVantageApiKey));
    }

    static SourceDescriptor<PriceQuote> yahoo() {
        return SourceDescriptor.<PriceQuote>builder()
                .name(YAHOO)
                .kind(DataKind.EQUITY)
                .endpoint(params -> "https://query2.finance.yahoo.com/v8/finance/chart/" + symbol(params)
                        + "?interval=1d&range=1d&includePrePost=false")
                .header("User-Agent", "Mozilla/5.0")
                .instrumentInPath(true)
                .parser(EquitySources::parseYahoo)
                .build();
    }

    static SourceDescriptor<PriceQuote> alphaVantage(String apiKey) {
        return SourceDescriptor.<PriceQuote>builder()
                .name(ALPHA_VANTAGE)
                .kind(DataKind.EQUITY)
                .endpoint(params -> "https://www.alphavantage.co/query?function=GLOBAL_QUOTE&symbol=" + symbol(params)
                        + "&apikey=" + apiKey)
                .parser(EquitySources::parseAlphaVantage)
                .build();
    }

    /**
     * Regular market price, else the first close, else the first open of the day
     */
    static PriceQuote parseYahoo(JsonNode body, ParseContext context) {
        JsonNode chart = JsonFields.object(body, "chart", context);
        JsonNode error = chart.get("error");
        if (error != null && !error.isNull()) {
            String description = error.path("description").asText(error.toString());
            if ("Not Found".equals(error.path("code").asText()) || description.contains("No data found")) {
                throw new UnknownInstrumentException(context.source(), "unknown symbol " + context.params().symbol());
            }
            throw new ParseException(context.source(), "chart error: " + description);
        }
        JsonNode result = JsonFields.firstElement(chart, "result", context);
        JsonNode meta = result.path("meta");
        JsonNode quote = result.path("indicators").path("quote").path(0);

        BigDecimal price;
        if (meta.hasNonNull("regularMarketPrice")) {
            price = JsonFields.decimal(meta, "regularMarketPrice", context);
        } else if (quote.path("close").path(0).isNumber()) {
            price = quote.path("close").path(0).decimalValue();
        } else if (quote.path("open").path(0).isNumber()) {
            price = quote.path("open").path(0).decimalValue();
        } else {
            throw new ParseException(context.source(), "no price in chart result");
        }
        String currency = meta.path("currency").asText(USD);
        if (!currency.matches("[A-Z]{3}")) {
            // Minor units such as GBp
            throw new ParseException(context.source(), "unsupported quote currency " + currency);
        }
        return PriceQuote.live(context.params().symbol(), price, currency,
                JsonFields.epochSeconds(meta, "regularMarketTime", context), context.source());
    }

    // {"Global Quote":{"01. symbol":"IBM","05. price":"187.6400","07. latest trading day":"2024-03-01"}}
    static PriceQuote parseAlphaVantage(JsonNode body, ParseContext context) {
        if (body.has("Note") || body.has("Information")) {
            // Rate-limit notices arrive as 200 with a message body
            throw new ParseException(context.source(), "rate limited: " + body.path("Note").asText(body.path("Information").asText()));
        }
        JsonNode quote = body.get("Global Quote");
        if (quote == null || !quote.isObject() || quote.isEmpty()) {
            throw new UnknownInstrumentException(context.source(), "unknown symbol " + context.params().symbol());
        }
        return PriceQuote.live(context.params().symbol(), JsonFields.decimal(quote, "05. price", context), USD,
                JsonFields.date(quote, "07. latest trading day", context), context.source());
    }

    private static String symbol(SourceParams params) {
        return URLEncoder.encode(params.symbol(), StandardCharsets.UTF_8);
    }
}
