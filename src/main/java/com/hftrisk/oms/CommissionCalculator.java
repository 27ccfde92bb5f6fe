package com.hftrisk.oms;

import com.hftrisk.domain.vo.Commission;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Estimates commission as order value x exchange rate, settled in the symbol's quote asset. */
@Component
public class CommissionCalculator {

    private static final Logger log = LoggerFactory.getLogger(CommissionCalculator.class);

    static final int COMMISSION_SCALE = 8;

    private final CommissionSchedule schedule;

    public CommissionCalculator(CommissionSchedule schedule) {
        this.schedule = schedule;
    }

    public Commission calculate(BigDecimal orderValue, String exchange, String symbol) {
        BigDecimal rate = schedule.rateFor(exchange);
        BigDecimal amount = orderValue.multiply(rate).setScale(COMMISSION_SCALE, RoundingMode.HALF_UP);
        String asset = schedule.assetFor(symbol);
        log.debug(
                "Commission estimated: exchange={}, symbol={}, value={}, rate={}, amount={} {}",
                exchange,
                symbol,
                orderValue.toPlainString(),
                rate.toPlainString(),
                amount.toPlainString(),
                asset);
        return Commission.of(amount, asset);
    }

    public CommissionSchedule getSchedule() {
        return schedule;
    }
}
