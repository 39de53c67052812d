package com.pricegate.domain.model;

/**
 * Parameters an endpoint builder may need: an instrument symbol or a base currency
 */
public record SourceParams(String symbol, String base) {

    public static SourceParams none() {
        return new SourceParams(null, null);
    }

    public static SourceParams forSymbol(String symbol) {
        return new SourceParams(symbol, null);
    }

    public static SourceParams forBase(String base) {
        return new SourceParams(null, base);
    }
}
