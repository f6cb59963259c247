package com.cryptotrader.risk;

import com.cryptotrader.domain.model.Position;
import java.util.List;

/** Source of truth for open positions, polled by the {@link RiskMonitor} on every tick. */
@FunctionalInterface
public interface PositionProvider {

    List<Position> fetchPositions() throws Exception;
}
