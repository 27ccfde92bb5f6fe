package com.hftrisk.unit.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.hftrisk.domain.model.Position;
import com.hftrisk.domain.model.StrategyState;
import com.hftrisk.event.RiskEvent;
import com.hftrisk.exception.ResourceNotFoundException;
import com.hftrisk.repository.memory.InMemoryPositionRepository;
import com.hftrisk.repository.memory.InMemoryRiskEventRepository;
import com.hftrisk.repository.memory.InMemoryRiskLimitsRepository;
import com.hftrisk.repository.memory.InMemoryStrategyRepository;
import com.hftrisk.risk.RiskLimits;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemoryRepositoriesTest {

    @Test
    @DisplayName("Missing risk limits raise not-found so defaults can apply")
    void riskLimits_notFound() {
        InMemoryRiskLimitsRepository repository = new InMemoryRiskLimitsRepository();
        RiskLimits limits = RiskLimits.defaults().toBuilder().maxOrderSize(BigDecimal.TEN).build();
        repository.save("s1", limits);

        assertThat(repository.getStrategyRiskLimits("s1")).isSameAs(limits);
        assertThatThrownBy(() -> repository.getStrategyRiskLimits("s2"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("Positions are keyed by strategy and symbol")
    void positions_keyed() {
        InMemoryPositionRepository repository = new InMemoryPositionRepository();
        repository.save(Position.builder().strategyId("s1").symbol("BTC/USDT").quantity(BigDecimal.ONE).build());
        repository.save(Position.builder().strategyId("s1").symbol("BTC/USDT").quantity(BigDecimal.TEN).build());
        repository.save(Position.builder().strategyId("s1").symbol("ETH/USDT").quantity(BigDecimal.ONE).build());

        assertThat(repository.findPosition("s1", "BTC/USDT")).hasValueSatisfying(
                p -> assertThat(p.getQuantity()).isEqualByComparingTo("10"));
        assertThat(repository.findByStrategy("s1")).hasSize(2);
        assertThat(repository.findPosition("s2", "BTC/USDT")).isEmpty();
    }

    @Test
    @DisplayName("Only active strategies are listed")
    void strategies_activeOnly() {
        InMemoryStrategyRepository repository = new InMemoryStrategyRepository();
        repository.save(StrategyState.builder().strategyId("a").active(true).build());
        repository.save(StrategyState.builder().strategyId("b").active(false).build());

        assertThat(repository.activeStrategyIds()).containsExactly("a");
        assertThat(repository.findStrategy("b")).isPresent();
    }

    @Test
    @DisplayName("Risk event log is append-only and filterable by strategy")
    void riskEvents_appendOnly() {
        InMemoryRiskEventRepository repository = new InMemoryRiskEventRepository();
        repository.save(RiskEvent.builder().id("1").strategyId("a").build());
        repository.save(RiskEvent.builder().id("1").strategyId("a").resolved(true).build());
        repository.save(RiskEvent.builder().id("2").strategyId("b").build());

        assertThat(repository.count()).isEqualTo(3);
        assertThat(repository.findByStrategy("a")).hasSize(2);
        assertThatThrownBy(() -> repository.findAll().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
