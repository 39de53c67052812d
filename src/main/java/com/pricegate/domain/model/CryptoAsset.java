package com.pricegate.domain.model;

/**
 * Crypto assets with a known price feed, keyed by ticker symbol
 */
public enum CryptoAsset {
    BTC("bitcoin"),
    ETH("ethereum"),
    USDT("tether"),
    BNB("binancecoin"),
    XRP("ripple"),
    ADA("cardano"),
    DOGE("dogecoin"),
    SOL("solana"),
    DOT("polkadot"),
    MATIC("matic-network");

    private final String coinId;

    CryptoAsset(String coinId) {
        this.coinId = coinId;
    }

    /**
     * Identifier of the asset at the price provider
     */
    public String getCoinId() {
        return coinId;
    }

    public static CryptoAsset fromSymbol(String symbol) {
        for (CryptoAsset asset : values()) {
            if (asset.name().equalsIgnoreCase(symbol == null ? null : symbol.trim())) {
                return asset;
            }
        }
        throw new IllegalArgumentException("Unsupported crypto symbol: " + symbol);
    }
}
