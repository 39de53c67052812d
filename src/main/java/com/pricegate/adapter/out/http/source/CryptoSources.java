package com.pricegate.adapter.out.http.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.pricegate.application.port.out.SourceDescriptor;
import com.pricegate.application.port.out.SourceDescriptor.ParseContext;
import com.pricegate.domain.model.CryptoAsset;
import com.pricegate.domain.model.DataKind;
import com.pricegate.domain.model.PriceQuote;
import com.pricegate.domain.model.SourceParams;
import com.pricegate.exception.ParseException;
import com.pricegate.exception.UnknownInstrumentException;

import java.util.List;
import java.util.Locale;

/**
 * Crypto spot price providers in priority order, both quoting USD per coin
 */
public final class CryptoSources {

    public static final String COINGECKO = "coingecko";
    public static final String COINBASE = "coinbase";

    private static final String USD = "USD";

    private CryptoSources() {
    }

    public static List<SourceDescriptor<PriceQuote>> all() {
        return List.of(coinGecko(), coinbase());
    }

    static SourceDescriptor<PriceQuote> coinGecko() {
        return SourceDescriptor.<PriceQuote>builder()
                .name(COINGECKO)
                .kind(DataKind.CRYPTO)
                .endpoint(params -> "https://api.coingecko.com/api/v3/simple/price?ids=" + coinId(params)
                        + "&vs_currencies=usd&include_last_updated_at=true")
                .header("Accept", "application/json")
                .parser(CryptoSources::parseCoinGecko)
                .build();
    }

    static SourceDescriptor<PriceQuote> coinbase() {
        return SourceDescriptor.<PriceQuote>builder()
                .name(COINBASE)
                .kind(DataKind.CRYPTO)
                .endpoint(params -> "https://api.coinbase.com/v2/prices/" + params.symbol() + "-USD/spot")
                .instrumentInPath(true)
                .parser(CryptoSources::parseCoinbase)
                .build();
    }

    // {"bitcoin":{"usd":62150.12,"last_updated_at":1709294400}}
    static PriceQuote parseCoinGecko(JsonNode body, ParseContext context) {
        String id = coinId(context.params());
        JsonNode coin = body.get(id);
        if (coin == null || !coin.isObject() || coin.isEmpty()) {
            // Unknown ids answer 200 with an empty object
            throw new UnknownInstrumentException(context.source(), "unknown coin " + id);
        }
        return PriceQuote.live(context.params().symbol(), JsonFields.decimal(coin, "usd", context), USD,
                JsonFields.epochSeconds(coin, "last_updated_at", context), context.source());
    }

    // {"data":{"base":"BTC","currency":"USD","amount":"62150.12"}}
    static PriceQuote parseCoinbase(JsonNode body, ParseContext context) {
        JsonNode data = JsonFields.object(body, "data", context);
        String currency = data.path("currency").asText(USD).toUpperCase(Locale.ROOT);
        if (!USD.equals(currency)) {
            throw new ParseException(context.source(), "unexpected quote currency " + currency);
        }
        return PriceQuote.live(context.params().symbol(), JsonFields.decimal(data, "amount", context), USD,
                context.receivedAt(), context.source());
    }

    private static String coinId(SourceParams params) {
        return CryptoAsset.fromSymbol(params.symbol()).getCoinId();
    }
}
