package com.pricegate.application.port.out;

import com.fasterxml.jackson.databind.JsonNode;
import com.pricegate.domain.model.DataKind;
import com.pricegate.domain.model.SourceParams;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One upstream provider: how to address it and how to read its answer.
 * Adding a provider means adding a descriptor; nothing else branches on provider names.
 *
 * @param <T> normalized value the parser produces
 */
@Value
@Builder
public class SourceDescriptor<T> {
    String name;
    DataKind kind;
    EndpointBuilder endpoint;
    @Singular Map<String, String> headers;
    ResponseParser<T> parser;
    boolean quotaLimited;
    /**
     * The URL path names the symbol or base, so a 404 means the instrument is not listed
     */
    boolean instrumentInPath;

    public String endpointFor(SourceParams params) {
        return endpoint.build(params);
    }

    public T parse(JsonNode body, SourceParams params, Instant receivedAt) {
        return parser.parse(body, new ParseContext(name, params, receivedAt));
    }

    @FunctionalInterface
    public interface EndpointBuilder {
        String build(SourceParams params);
    }

    /**
     * Turns a JSON body into a value; throws {@link com.pricegate.exception.ParseException}
     * when expected fields are missing.
     */
    @FunctionalInterface
    public interface ResponseParser<T> {
        T parse(JsonNode body, ParseContext context);
    }

    public record ParseContext(String source, SourceParams params, Instant receivedAt) {
    }
}
