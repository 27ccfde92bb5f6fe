package com.hftrisk.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;

import com.hftrisk.domain.enums.OrderSide;
import com.hftrisk.domain.model.Position;
import com.hftrisk.repository.memory.InMemoryPositionRepository;
import com.hftrisk.risk.PositionExposureCalculator;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PositionExposureCalculatorTest {

    @Test
    @DisplayName("Exposure sums notionals at mark price, falling back to average price")
    void sumsNotionals() {
        InMemoryPositionRepository positions = new InMemoryPositionRepository();
        positions.save(Position.builder()
                .strategyId("s1")
                .symbol("BTC/USDT")
                .side(OrderSide.BUY)
                .quantity(new BigDecimal("0.5"))
                .averagePrice(new BigDecimal("40000"))
                .markPrice(new BigDecimal("42000"))
                .build());
        positions.save(Position.builder()
                .strategyId("s1")
                .symbol("ETH/USDT")
                .side(OrderSide.SELL)
                .quantity(new BigDecimal("2"))
                .averagePrice(new BigDecimal("3000"))
                .build());
        positions.save(Position.builder()
                .strategyId("s2")
                .symbol("BTC/USDT")
                .quantity(new BigDecimal("10"))
                .markPrice(new BigDecimal("42000"))
                .build());

        PositionExposureCalculator calculator = new PositionExposureCalculator(positions);

        assertThat(calculator.currentExposure("s1")).isEqualByComparingTo("27000");
        assertThat(calculator.currentExposure("none")).isEqualByComparingTo("0");
    }
}
