package com.pricegate.domain.model;

import java.time.Instant;

/**
 * Common shape of every value that travels through the fallback cascade.
 *
 * @param <T> the concrete value type, so re-tagging keeps the type
 */
public interface Quotation<T extends Quotation<T>> {

    /**
     * Instant the upstream produced the value
     */
    Instant asOf();

    /**
     * Provider name, or a fallback marker such as {@code file-fallback}
     */
    String source();

    boolean fallback();

    ServedFrom cacheSource();

    /**
     * Copy of this value re-tagged as served from the given tier
     */
    T servedAs(ServedFrom tier, String source);
}
