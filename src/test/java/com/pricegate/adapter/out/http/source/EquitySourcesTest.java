package com.pricegate.adapter.out.http.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricegate.application.port.out.SourceDescriptor.ParseContext;
import com.pricegate.domain.model.PriceQuote;
import com.pricegate.domain.model.SourceParams;
import com.pricegate.exception.ParseException;
import com.pricegate.exception.UnknownInstrumentException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test for the equity provider descriptors and their response parsers
 */
class EquitySourcesTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Instant RECEIVED = Instant.parse("2024-03-01T21:00:00Z");

    @Test
    void yahoo_shouldEncodeSymbolInPath() {
        String url = EquitySources.yahoo().endpointFor(SourceParams.forSymbol("BRK B"));

        assertTrue(url.contains("/chart/BRK+B?"), url);
        assertEquals("Mozilla/5.0", EquitySources.yahoo().getHeaders().get("User-Agent"));
        assertTrue(EquitySources.yahoo().isInstrumentInPath());
    }

    @Test
    void alphaVantage_shouldCarryApiKey() {
        String url = EquitySources.alphaVantage("demo").endpointFor(SourceParams.forSymbol("IBM"));

        assertTrue(url.endsWith("symbol=IBM&apikey=demo"), url);
    }

    @Test
    void parseYahoo_shouldPreferRegularMarketPrice() throws Exception {
        JsonNode body = json("{\"chart\":{\"result\":[{\"meta\":{\"currency\":\"USD\",\"symbol\":\"AAPL\","
                + "\"regularMarketPrice\":180.75,\"regularMarketTime\":1709326800},"
                + "\"indicators\":{\"quote\":[{\"close\":[179.5],\"open\":[178.0]}]}}],\"error\":null}}");

        PriceQuote quote = EquitySources.parseYahoo(body, context("AAPL"));

        assertEquals("AAPL", quote.symbol());
        assertEquals(0, new BigDecimal("180.75").compareTo(quote.value()));
        assertEquals("USD", quote.currency());
        assertEquals(Instant.ofEpochSecond(1709326800L), quote.asOf());
        assertEquals("yahoo-finance", quote.source());
    }

    @Test
    void parseYahoo_shouldFallBackToCloseThenOpen() throws Exception {
        JsonNode withClose = json("{\"chart\":{\"result\":[{\"meta\":{\"currency\":\"USD\"},"
                + "\"indicators\":{\"quote\":[{\"close\":[179.5],\"open\":[178.0]}]}}]}}");
        JsonNode withOpen = json("{\"chart\":{\"result\":[{\"meta\":{\"currency\":\"USD\"},"
                + "\"indicators\":{\"quote\":[{\"close\":[null],\"open\":[178.0]}]}}]}}");

        assertEquals(0, new BigDecimal("179.5").compareTo(EquitySources.parseYahoo(withClose, context("AAPL")).value()));
        PriceQuote fromOpen = EquitySources.parseYahoo(withOpen, context("AAPL"));
        assertEquals(0, new BigDecimal("178.0").compareTo(fromOpen.value()));
        assertEquals(RECEIVED, fromOpen.asOf());
    }

    @Test
    void parseYahoo_shouldReportUnlistedSymbolAsUnknown() throws Exception {
        JsonNode body = json("{\"chart\":{\"result\":null,\"error\":{\"code\":\"Not Found\","
                + "\"description\":\"No data found, symbol may be delisted\"}}}");

        UnknownInstrumentException error = assertThrows(UnknownInstrumentException.class,
                () -> EquitySources.parseYahoo(body, context("ZZZZ")));
        assertTrue(error.getMessage().contains("ZZZZ"));
    }

    @Test
    void parseYahoo_shouldRejectOtherChartErrors() throws Exception {
        JsonNode body = json("{\"chart\":{\"result\":null,\"error\":{\"code\":\"Internal Server Error\","
                + "\"description\":\"backend timeout\"}}}");

        ParseException error = assertThrows(ParseException.class, () -> EquitySources.parseYahoo(body, context("AAPL")));
        assertTrue(error.getMessage().contains("backend timeout"));
    }

    @Test
    void parseYahoo_shouldRejectMinorCurrencyUnits() throws Exception {
        JsonNode body = json("{\"chart\":{\"result\":[{\"meta\":{\"currency\":\"GBp\",\"regularMarketPrice\":512.4}}]}}");

        assertThrows(ParseException.class, () -> EquitySources.parseYahoo(body, context("VOD.L")));
    }

    @Test
    void parseAlphaVantage_shouldReadGlobalQuote() throws Exception {
        JsonNode body = json("{\"Global Quote\":{\"01. symbol\":\"IBM\",\"05. price\":\"187.6400\","
                + "\"07. latest trading day\":\"2024-03-01\"}}");

        PriceQuote quote = EquitySources.parseAlphaVantage(body, context("IBM"));

        assertEquals(new BigDecimal("187.6400"), quote.value());
        assertEquals("USD", quote.currency());
        assertEquals(Instant.parse("2024-03-01T00:00:00Z"), quote.asOf());
    }

    @Test
    void parseAlphaVantage_shouldTreatRateLimitNoticeAsFailure() throws Exception {
        JsonNode body = json("{\"Note\":\"Thank you for using Alpha Vantage! Our standard API call frequency is 5 calls per minute\"}");

        ParseException error = assertThrows(ParseException.class,
                () -> EquitySources.parseAlphaVantage(body, context("IBM")));
        assertTrue(error.getMessage().contains("rate limited"));
    }

    @Test
    void parseAlphaVantage_shouldRejectEmptyQuote() throws Exception {
        JsonNode body = json("{\"Global Quote\":{}}");

        assertThrows(UnknownInstrumentException.class, () -> EquitySources.parseAlphaVantage(body, context("NOPE")));
    }

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    private static ParseContext context(String symbol) {
        return new ParseContext("yahoo-finance", SourceParams.forSymbol(symbol), RECEIVED);
    }
}
