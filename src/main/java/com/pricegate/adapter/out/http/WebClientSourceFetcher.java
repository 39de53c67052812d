package com.pricegate.adapter.out.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricegate.application.port.out.PriceSourceFetcher;
import com.pricegate.application.port.out.SourceDescriptor;
import com.pricegate.domain.model.SourceParams;
import com.pricegate.exception.ParseException;
import com.pricegate.exception.PriceSourceException;
import com.pricegate.exception.TransportException;
import com.pricegate.exception.UnknownInstrumentException;
import com.pricegate.exception.UpstreamStatusException;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;

/**
 * HTTP adapter issuing one GET per call to an upstream source
 * Implements PriceSourceFetcher output port
 */
@Slf4j
public class WebClientSourceFetcher implements PriceSourceFetcher {

    private final WebClient client;
    private final ObjectMapper mapper;
    private final Duration timeout;
    private final Clock clock;

    public WebClientSourceFetcher(WebClient client, ObjectMapper mapper, Duration timeout, Clock clock) {
        this.client = client;
        this.mapper = mapper;
        this.timeout = timeout;
        this.clock = clock;
    }

    @Override
    public <T> Future<T> fetch(SourceDescriptor<T> source, SourceParams params) {
        String url;
        try {
            url = source.endpointFor(params);
        } catch (RuntimeException e) {
            return Future.failedFuture(new ParseException(source.getName(), "cannot build request: " + e.getMessage(), e));
        }

        HttpRequest<Buffer> request = client.getAbs(url).timeout(timeout.toMillis());
        source.getHeaders().forEach(request::putHeader);
        log.debug("GET {} ({})", url, source.getName());

        return request.send().transform(ar -> {
            if (ar.failed()) {
                return Future.failedFuture(new TransportException(source.getName(), ar.cause()));
            }
            HttpResponse<Buffer> response = ar.result();
            if (response.statusCode() == 404 && source.isInstrumentInPath()) {
                return Future.failedFuture(new UnknownInstrumentException(source.getName(), "not listed: " + instrument(params)));
            }
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                return Future.failedFuture(new UpstreamStatusException(source.getName(), response.statusCode()));
            }
            try {
                return Future.succeededFuture(source.parse(readBody(source, response), params, clock.instant()));
            } catch (PriceSourceException e) {
                return Future.failedFuture(e);
            } catch (RuntimeException e) {
                return Future.failedFuture(new ParseException(source.getName(), "unexpected body: " + e.getMessage(), e));
            }
        });
    }

    private static String instrument(SourceParams params) {
        return params.symbol() != null ? params.symbol() : params.base();
    }

    private JsonNode readBody(SourceDescriptor<?> source, HttpResponse<Buffer> response) {
        String body = response.bodyAsString();
        if (body == null || body.isBlank()) {
            throw new ParseException(source.getName(), "empty body");
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ParseException(source.getName(), "body is not JSON", e);
        }
    }
}
