package com.hftrisk.oms;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Commission rates and settlement assets.
 *
 * <p>The rate is the exchange override when present, else the default rate. The settlement
 * asset is resolved in order: symbol override, quote currency derived from the symbol,
 * fallback asset.
 */
@Value
@Builder
public class CommissionSchedule {

    /** Quote currencies recognised at the end of concatenated symbols such as BTCUSDT. */
    static final List<String> KNOWN_QUOTES = List.of("USDT", "USDC", "BUSD", "FDUSD", "USD", "EUR", "BTC", "ETH");

    @Builder.Default
    BigDecimal defaultRate = new BigDecimal("0.001");

    @Singular
    Map<String, BigDecimal> exchangeRates;

    @Singular
    Map<String, String> symbolAssets;

    @Builder.Default
    String fallbackAsset = "USDT";

    public static CommissionSchedule defaults() {
        return CommissionSchedule.builder().build();
    }

    public BigDecimal rateFor(String exchange) {
        if (exchange == null) {
            return defaultRate;
        }
        BigDecimal override = exchangeRates.get(exchange.toLowerCase(Locale.ROOT));
        return override != null ? override : defaultRate;
    }

    public String assetFor(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return fallbackAsset;
        }
        String override = symbolAssets.get(symbol.toUpperCase(Locale.ROOT));
        if (override != null) {
            return override;
        }
        String quote = quoteOf(symbol);
        return quote != null ? quote : fallbackAsset;
    }

    /** BTC/USDT, BTC-USDT, BTC_USDT and BTCUSDT all yield USDT. Null when unrecognised. */
    static String quoteOf(String symbol) {
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        for (char separator : new char[] {'/', '-', '_'}) {
            int idx = normalized.lastIndexOf(separator);
            if (idx > 0 && idx < normalized.length() - 1) {
                return normalized.substring(idx + 1);
            }
        }
        for (String quote : KNOWN_QUOTES) {
            if (normalized.length() > quote.length() && normalized.endsWith(quote)) {
                return quote;
            }
        }
        return null;
    }
}
