package com.hftrisk.risk;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Tracks per-strategy equity samples and derives drawdown as the decline from the running
 * peak: {@code (peak - current) / peak * 100}. A strategy without samples, or with a
 * non-positive peak, has zero drawdown.
 */
@Component
public class EquityDrawdownTracker implements DrawdownCalculator {

    private static final Logger log = LoggerFactory.getLogger(EquityDrawdownTracker.class);

    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final int PERCENT_SCALE = 4;

    private final Map<String, EquityWatermark> watermarks = new ConcurrentHashMap<>();

    /** Records the latest equity value of a strategy and raises its peak if exceeded. */
    public void recordEquity(String strategyId, BigDecimal equity) {
        watermarks.compute(strategyId, (id, current) -> {
            if (current == null) {
                return new EquityWatermark(equity, equity);
            }
            BigDecimal peak = equity.compareTo(current.getPeak()) > 0 ? equity : current.getPeak();
            return new EquityWatermark(peak, equity);
        });
        log.debug("Equity recorded: strategyId={}, equity={}", strategyId, equity.toPlainString());
    }

    /** Forgets the strategy's samples, e.g. at the start of a trading day. */
    public void reset(String strategyId) {
        watermarks.remove(strategyId);
    }

    @Override
    public BigDecimal currentDrawdownPercent(String strategyId) {
        EquityWatermark watermark = watermarks.get(strategyId);
        if (watermark == null || watermark.getPeak().signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal decline = watermark.getPeak().subtract(watermark.getCurrent());
        if (decline.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return decline.multiply(HUNDRED).divide(watermark.getPeak(), PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    @Getter
    private static final class EquityWatermark {
        private final BigDecimal peak;
        private final BigDecimal current;

        private EquityWatermark(BigDecimal peak, BigDecimal current) {
            this.peak = peak;
            this.current = current;
        }
    }
}
