package com.pricegate.adapter.out.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricegate.application.port.out.SourceDescriptor;
import com.pricegate.domain.model.DataKind;
import com.pricegate.domain.model.SourceParams;
import com.pricegate.exception.ParseException;
import com.pricegate.exception.TransportException;
import com.pricegate.exception.UnknownInstrumentException;
import com.pricegate.exception.UpstreamStatusException;
import com.pricegate.support.MutableClock;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.client.WebClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.pricegate.support.Futures.await;
import static com.pricegate.support.Futures.awaitFailure;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test for WebClientSourceFetcher against an in-process HTTP server
 */
class WebClientSourceFetcherTest {

    private Vertx vertx;
    private WebClient client;
    private HttpServer server;
    private WebClientSourceFetcher fetcher;
    private String baseUrl;

    @BeforeEach
    void setUp() throws Exception {
        vertx = Vertx.vertx();
        server = await(vertx.createHttpServer()
                .requestHandler(request -> {
                    switch (request.path()) {
                        case "/ok" -> request.response()
                                .putHeader("Content-Type", "application/json")
                                .end("{\"price\": 12.5, \"symbol\": \"" + request.getParam("symbol") + "\"}");
                        case "/agent" -> request.response()
                                .end("{\"agent\": \"" + request.getHeader("User-Agent") + "\"}");
                        case "/error" -> request.response().setStatusCode(503).end("{\"error\": \"down\"}");
                        case "/html" -> request.response().end("<html>maintenance</html>");
                        case "/empty" -> request.response().end();
                        case "/slow" -> {
                            // never answers
                        }
                        default -> request.response().setStatusCode(404).end();
                    }
                })
                .listen(0));
        baseUrl = "http://localhost:" + server.actualPort();
        client = WebClient.create(vertx);
        fetcher = new WebClientSourceFetcher(client, new ObjectMapper(), Duration.ofMillis(300),
                MutableClock.at("2024-03-01T12:00:00Z"));
    }

    @AfterEach
    void tearDown() throws Exception {
        if (client != null) {
            client.close();
        }
        if (vertx != null) {
            CountDownLatch latch = new CountDownLatch(1);
            vertx.close().onComplete(ar -> latch.countDown());
            latch.await(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void fetch_shouldParseSuccessfulResponse() throws Exception {
        SourceDescriptor<BigDecimal> source = priceSource("/ok?symbol=${symbol}");

        BigDecimal price = await(fetcher.fetch(source, SourceParams.forSymbol("AAPL")));

        assertEquals(0, new BigDecimal("12.5").compareTo(price));
    }

    @Test
    void fetch_shouldPassSymbolAndReceivedAtToParser() throws Exception {
        SourceDescriptor<String> source = SourceDescriptor.<String>builder()
                .name("echo").kind(DataKind.EQUITY)
                .endpoint(params -> baseUrl + "/ok?symbol=" + params.symbol())
                .parser((body, context) -> body.path("symbol").asText() + "@" + context.receivedAt())
                .build();

        String echoed = await(fetcher.fetch(source, SourceParams.forSymbol("MSFT")));

        assertEquals("MSFT@2024-03-01T12:00:00Z", echoed);
    }

    @Test
    void fetch_shouldSendSourceHeaders() throws Exception {
        SourceDescriptor<String> source = SourceDescriptor.<String>builder()
                .name("agent").kind(DataKind.METAL)
                .endpoint(params -> baseUrl + "/agent")
                .header("User-Agent", "Mozilla/5.0 test")
                .parser((body, context) -> body.path("agent").asText())
                .build();

        assertEquals("Mozilla/5.0 test", await(fetcher.fetch(source, SourceParams.none())));
    }

    @Test
    void fetch_shouldFailWithStatusOnNon2xx() throws Exception {
        Throwable error = awaitFailure(fetcher.fetch(priceSource("/error"), SourceParams.none()));

        UpstreamStatusException status = assertInstanceOf(UpstreamStatusException.class, error);
        assertEquals(503, status.getStatus());
        assertEquals("test-source", status.getSource());
    }

    @Test
    void fetch_shouldReportNotFoundAsUnknownInstrumentWhenPathNamesIt() throws Exception {
        SourceDescriptor<BigDecimal> source = SourceDescriptor.<BigDecimal>builder()
                .name("chart").kind(DataKind.EQUITY)
                .endpoint(params -> baseUrl + "/chart/" + params.symbol())
                .instrumentInPath(true)
                .parser((body, context) -> body.path("price").decimalValue())
                .build();

        Throwable error = awaitFailure(fetcher.fetch(source, SourceParams.forSymbol("ZZZZ")));

        UnknownInstrumentException unknown = assertInstanceOf(UnknownInstrumentException.class, error);
        assertTrue(unknown.getMessage().contains("ZZZZ"));
    }

    @Test
    void fetch_shouldKeepNotFoundAsStatusFailureOtherwise() throws Exception {
        Throwable error = awaitFailure(fetcher.fetch(priceSource("/moved"), SourceParams.forSymbol("AAPL")));

        UpstreamStatusException status = assertInstanceOf(UpstreamStatusException.class, error);
        assertEquals(404, status.getStatus());
    }

    @Test
    void fetch_shouldFailWithParseErrorOnNonJsonBody() throws Exception {
        Throwable error = awaitFailure(fetcher.fetch(priceSource("/html"), SourceParams.none()));

        assertInstanceOf(ParseException.class, error);
    }

    @Test
    void fetch_shouldFailWithParseErrorOnEmptyBody() throws Exception {
        Throwable error = awaitFailure(fetcher.fetch(priceSource("/empty"), SourceParams.none()));

        assertInstanceOf(ParseException.class, error);
    }

    @Test
    void fetch_shouldWrapUnexpectedParserFailures() throws Exception {
        SourceDescriptor<BigDecimal> source = SourceDescriptor.<BigDecimal>builder()
                .name("broken").kind(DataKind.METAL)
                .endpoint(params -> baseUrl + "/ok")
                .parser((body, context) -> {
                    throw new IllegalStateException("boom");
                })
                .build();

        Throwable error = awaitFailure(fetcher.fetch(source, SourceParams.none()));

        assertInstanceOf(ParseException.class, error);
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    @Test
    void fetch_shouldPassParserFailuresThrough() throws Exception {
        SourceDescriptor<BigDecimal> source = SourceDescriptor.<BigDecimal>builder()
                .name("strict").kind(DataKind.METAL)
                .endpoint(params -> baseUrl + "/ok")
                .parser((body, context) -> {
                    throw new ParseException(context.source(), "missing field rates");
                })
                .build();

        Throwable error = awaitFailure(fetcher.fetch(source, SourceParams.none()));

        assertEquals("strict: missing field rates", error.getMessage());
    }

    @Test
    void fetch_shouldFailWithTransportErrorOnTimeout() throws Exception {
        Throwable error = awaitFailure(fetcher.fetch(priceSource("/slow"), SourceParams.none()));

        assertInstanceOf(TransportException.class, error);
    }

    @Test
    void fetch_shouldFailWithTransportErrorWhenUnreachable() throws Exception {
        int port = server.actualPort();
        await(server.close());
        SourceDescriptor<BigDecimal> source = SourceDescriptor.<BigDecimal>builder()
                .name("gone").kind(DataKind.METAL)
                .endpoint(params -> "http://localhost:" + port + "/ok")
                .parser((body, context) -> body.path("price").decimalValue())
                .build();

        Throwable error = awaitFailure(fetcher.fetch(source, SourceParams.none()));

        assertInstanceOf(TransportException.class, error);
    }

    @Test
    void fetch_shouldFailWithParseErrorWhenEndpointCannotBeBuilt() throws Exception {
        SourceDescriptor<BigDecimal> source = SourceDescriptor.<BigDecimal>builder()
                .name("keyless").kind(DataKind.METAL)
                .endpoint(params -> {
                    throw new IllegalArgumentException("API key missing");
                })
                .parser((body, context) -> BigDecimal.ONE)
                .build();

        Throwable error = awaitFailure(fetcher.fetch(source, SourceParams.none()));

        assertInstanceOf(ParseException.class, error);
    }

    private SourceDescriptor<BigDecimal> priceSource(String path) {
        return SourceDescriptor.<BigDecimal>builder()
                .name("test-source").kind(DataKind.METAL)
                .endpoint(params -> baseUrl + path.replace("${symbol}", String.valueOf(params.symbol())))
                .parser((body, context) -> body.path("price").decimalValue())
                .build();
    }
}
