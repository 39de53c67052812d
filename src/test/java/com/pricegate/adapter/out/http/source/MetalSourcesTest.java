package com.pricegate.adapter.out.http.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricegate.application.port.out.SourceDescriptor;
import com.pricegate.application.port.out.SourceDescriptor.ParseContext;
import com.pricegate.domain.model.MetalPrices;
import com.pricegate.domain.model.ServedFrom;
import com.pricegate.domain.model.SourceParams;
import com.pricegate.exception.ParseException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test for the metal provider descriptors and their response parsers
 */
class MetalSourcesTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Instant RECEIVED = Instant.parse("2024-03-01T12:00:00Z");

    @Test
    void all_shouldRegisterQuotaLimitedProviderOnlyWithKey() {
        List<SourceDescriptor<MetalPrices>> keyless = MetalSources.all("");
        List<SourceDescriptor<MetalPrices>> keyed = MetalSources.all("secret");

        assertEquals(List.of("frankfurter", "goldprice", "metals.live"),
                keyless.stream().map(SourceDescriptor::getName).toList());
        assertEquals(4, keyed.size());
        assertEquals("metalpriceapi", keyed.get(3).getName());
        assertTrue(keyed.get(3).isQuotaLimited());
        assertTrue(keyed.get(3).endpointFor(SourceParams.none()).contains("api_key=secret"));
        assertFalse(keyed.get(0).isQuotaLimited());
    }

    @Test
    void goldPrice_shouldSendBrowserUserAgent() {
        assertEquals("Mozilla/5.0", MetalSources.goldPrice().getHeaders().get("User-Agent"));
    }

    @Test
    void parseFrankfurter_shouldConvertOuncesToGrams() throws Exception {
        JsonNode body = json("{\"base\":\"XAU\",\"date\":\"2024-03-01\",\"rates\":{\"USD\":2044.1,\"XAG\":89.2}}");

        MetalPrices prices = MetalSources.parseFrankfurter(body, context("frankfurter"));

        assertEquals(new BigDecimal("65.72"), prices.gold());
        assertEquals(new BigDecimal("0.74"), prices.silver());
        assertEquals("USD", prices.currency());
        assertEquals("frankfurter", prices.source());
        assertEquals(ServedFrom.LIVE, prices.cacheSource());
        assertFalse(prices.fallback());
        assertEquals(Instant.parse("2024-03-01T00:00:00Z"), prices.asOf());
    }

    @Test
    void parseFrankfurter_shouldRejectMissingSilverRate() throws Exception {
        JsonNode body = json("{\"rates\":{\"USD\":2044.1}}");

        assertThrows(ParseException.class, () -> MetalSources.parseFrankfurter(body, context("frankfurter")));
    }

    @Test
    void parseGoldPrice_shouldReadFirstItem() throws Exception {
        JsonNode body = json("{\"ts\":1709290000000,\"items\":[{\"curr\":\"USD\",\"xauPrice\":2916.6,\"xagPrice\":32.5}]}");

        MetalPrices prices = MetalSources.parseGoldPrice(body, context("goldprice"));

        assertEquals(new BigDecimal("93.77"), prices.gold());
        assertEquals(new BigDecimal("1.04"), prices.silver());
        assertEquals(Instant.ofEpochMilli(1709290000000L), prices.asOf());
    }

    @Test
    void parseGoldPrice_shouldRejectEmptyItems() throws Exception {
        JsonNode body = json("{\"ts\":1709290000000,\"items\":[]}");

        assertThrows(ParseException.class, () -> MetalSources.parseGoldPrice(body, context("goldprice")));
    }

    @Test
    void parseMetalsLive_shouldPickMetalsByName() throws Exception {
        JsonNode body = json("[{\"metal\":\"platinum\",\"price\":900},"
                + "{\"metal\":\"silver\",\"price\":22.9},{\"metal\":\"gold\",\"price\":\"2044.1\"}]");

        MetalPrices prices = MetalSources.parseMetalsLive(body, context("metals.live"));

        assertEquals(new BigDecimal("65.72"), prices.gold());
        assertEquals(new BigDecimal("0.74"), prices.silver());
        assertEquals(RECEIVED, prices.asOf());
    }

    @Test
    void parseMetalsLive_shouldRejectMissingSilver() throws Exception {
        JsonNode body = json("[{\"metal\":\"gold\",\"price\":2044.1}]");

        ParseException error = assertThrows(ParseException.class,
                () -> MetalSources.parseMetalsLive(body, context("metals.live")));
        assertTrue(error.getMessage().contains("silver"));
    }

    @Test
    void parseMetalsLive_shouldRejectObjectBody() throws Exception {
        JsonNode body = json("{\"error\":\"rate limited\"}");

        assertThrows(ParseException.class, () -> MetalSources.parseMetalsLive(body, context("metals.live")));
    }

    @Test
    void parseMetalPriceApi_shouldInvertRates() throws Exception {
        JsonNode body = json("{\"success\":true,\"base\":\"USD\",\"timestamp\":1709290000,"
                + "\"rates\":{\"XAU\":0.0005,\"XAG\":0.04}}");

        MetalPrices prices = MetalSources.parseMetalPriceApi(body, context("metalpriceapi"));

        assertEquals(new BigDecimal("64.30"), prices.gold());
        assertEquals(new BigDecimal("0.80"), prices.silver());
        assertEquals(Instant.ofEpochSecond(1709290000L), prices.asOf());
    }

    @Test
    void parseMetalPriceApi_shouldRejectZeroRate() throws Exception {
        JsonNode body = json("{\"rates\":{\"XAU\":0,\"XAG\":0.04}}");

        assertThrows(ParseException.class, () -> MetalSources.parseMetalPriceApi(body, context("metalpriceapi")));
    }

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    private static ParseContext context(String source) {
        return new ParseContext(source, SourceParams.none(), RECEIVED);
    }
}
