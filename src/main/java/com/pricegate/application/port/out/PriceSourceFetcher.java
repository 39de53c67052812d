package com.pricegate.application.port.out;

import com.pricegate.domain.model.SourceParams;
import io.vertx.core.Future;

/**
 * Output port for calling one upstream source
 */
public interface PriceSourceFetcher {

    /**
     * Issue exactly one request to the source and parse the answer
     * @return Future with the parsed value, or failed with a
     *         {@link com.pricegate.exception.PriceSourceException}
     */
    <T> Future<T> fetch(SourceDescriptor<T> source, SourceParams params);
}
