package com.hftrisk.risk;

import com.hftrisk.domain.model.Position;
import java.math.BigDecimal;
import org.springframework.stereotype.Component;

/**
 * Exposure as the sum of position notionals held by the strategy, each valued at its mark
 * price (average entry price when no mark is known).
 */
@Component
public class PositionExposureCalculator implements ExposureCalculator {

    private final PositionProvider positionProvider;

    public PositionExposureCalculator(PositionProvider positionProvider) {
        this.positionProvider = positionProvider;
    }

    @Override
    public BigDecimal currentExposure(String strategyId) {
        BigDecimal exposure = BigDecimal.ZERO;
        for (Position position : positionProvider.findByStrategy(strategyId)) {
            exposure = exposure.add(position.notional());
        }
        return exposure;
    }
}
