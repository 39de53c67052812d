package com.pricegate.application.service;

import com.pricegate.application.port.out.SourceDescriptor;
import com.pricegate.domain.model.DataKind;
import com.pricegate.domain.model.MetalPrices;
import com.pricegate.domain.model.PriceQuote;
import com.pricegate.domain.model.RateTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Process-wide table of upstream sources per data kind.
 *
 * <p>Kinds with equivalent free-tier providers get one of {@link #FIXED_ORDERS} per call to
 * spread load; exchange-rate providers are tiered by reliability and keep priority order.
 */
public class SourceRegistry {

    /**
     * Indices into a source list. Indices past the end are skipped; sources not named by the
     * order keep their registration order at the tail, so quota-limited providers registered
     * last stay last.
     */
    static final int[][] FIXED_ORDERS = {
            {0, 1, 2},
            {1, 2, 0},
            {2, 0, 1},
            {2, 1, 0}
    };

    private final List<SourceDescriptor<MetalPrices>> metalSources;
    private final List<SourceDescriptor<PriceQuote>> equitySources;
    private final List<SourceDescriptor<RateTable>> rateSources;
    private final List<SourceDescriptor<PriceQuote>> cryptoSources;

    public SourceRegistry(List<SourceDescriptor<MetalPrices>> metalSources,
                          List<SourceDescriptor<PriceQuote>> equitySources,
                          List<SourceDescriptor<RateTable>> rateSources,
                          List<SourceDescriptor<PriceQuote>> cryptoSources) {
        this.metalSources = List.copyOf(metalSources);
        this.equitySources = List.copyOf(equitySources);
        this.rateSources = List.copyOf(rateSources);
        this.cryptoSources = List.copyOf(cryptoSources);
    }

    public List<SourceDescriptor<MetalPrices>> metalSources(long seed) {
        return ordered(DataKind.METAL, metalSources, seed);
    }

    public List<SourceDescriptor<PriceQuote>> equitySources(long seed) {
        return ordered(DataKind.EQUITY, equitySources, seed);
    }

    public List<SourceDescriptor<RateTable>> rateSources(long seed) {
        return ordered(DataKind.EXCHANGE_RATE, rateSources, seed);
    }

    public List<SourceDescriptor<PriceQuote>> cryptoSources(long seed) {
        return ordered(DataKind.CRYPTO, cryptoSources, seed);
    }

    public int size(DataKind kind) {
        switch (kind) {
            case METAL:
                return metalSources.size();
            case EQUITY:
                return equitySources.size();
            case CRYPTO:
                return cryptoSources.size();
            default:
                return rateSources.size();
        }
    }

    private static <T> List<T> ordered(DataKind kind, List<T> sources, long seed) {
        return kind.isRandomizedOrder() ? permutation(sources, seed) : sources;
    }

    /**
     * Deterministic for a given seed: the seed picks one of the fixed orders uniformly.
     */
    public static <T> List<T> permutation(List<T> sources, long seed) {
        int[] order = FIXED_ORDERS[new Random(seed).nextInt(FIXED_ORDERS.length)];
        List<T> result = new ArrayList<>(sources.size());
        boolean[] taken = new boolean[sources.size()];
        for (int index : order) {
            if (index < sources.size()) {
                result.add(sources.get(index));
                taken[index] = true;
            }
        }
        for (int i = 0; i < sources.size(); i++) {
            if (!taken[i]) {
                result.add(sources.get(i));
            }
        }
        return List.copyOf(result);
    }
}
