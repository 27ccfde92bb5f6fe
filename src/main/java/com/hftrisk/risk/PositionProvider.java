package com.hftrisk.risk;

import com.hftrisk.domain.model.Position;
import java.util.List;
import java.util.Optional;

/** Read access to the external position store. */
public interface PositionProvider {

    Optional<Position> findPosition(String strategyId, String symbol);

    List<Position> findByStrategy(String strategyId);
}
