package com.hftrisk.config;

import com.hftrisk.oms.CommissionSchedule;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the {@link CommissionSchedule} from {@code hftrisk.commission.*}.
 *
 * <p>Overrides are inline maps, e.g.
 * {@code exchange-rates: "{binance: '0.00075', kraken: '0.0016'}"}. Exchange keys are
 * matched case-insensitively; symbol keys are upper-cased.
 */
@Configuration
public class CommissionConfig {

    @Bean
    public CommissionSchedule commissionSchedule(
            @Value("${hftrisk.commission.default-rate:0.001}") BigDecimal defaultRate,
            @Value("#{${hftrisk.commission.exchange-rates:{:}}}") Map<String, String> exchangeRates,
            @Value("#{${hftrisk.commission.symbol-assets:{:}}}") Map<String, String> symbolAssets,
            @Value("${hftrisk.commission.fallback-asset:USDT}") String fallbackAsset) {
        CommissionSchedule.CommissionScheduleBuilder builder = CommissionSchedule.builder()
                .defaultRate(defaultRate)
                .fallbackAsset(fallbackAsset);
        exchangeRates.forEach((exchange, rate) ->
                builder.exchangeRate(exchange.toLowerCase(Locale.ROOT), new BigDecimal(rate)));
        symbolAssets.forEach((symbol, asset) ->
                builder.symbolAsset(symbol.toUpperCase(Locale.ROOT), asset.toUpperCase(Locale.ROOT)));
        return builder.build();
    }
}
