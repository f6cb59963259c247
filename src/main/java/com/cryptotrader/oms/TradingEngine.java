package com.cryptotrader.oms;

import com.cryptotrader.domain.model.Order;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

/**
 * Position-level execution used by the risk layer. Every call carries the reason
 * and the id of the risk evaluation that caused it.
 */
public interface TradingEngine {

    Order closePosition(String exchange, String symbol, String reason, String evaluationId);

    /**
     * Closes part of a position.
     *
     * @param percentage share of the current quantity to close, in (0, 100]
     */
    Order partialClosePosition(
            String exchange, String symbol, BigDecimal percentage, String reason, String evaluationId);

    List<Order> closeAllPositions(String reason, String evaluationId);

    /**
     * Refuses new entries until {@link #resumeTrading} or until {@code duration}
     * elapses. A null duration blocks indefinitely.
     */
    void blockNewTrades(Duration duration, String reason, String evaluationId);

    boolean isTradingBlocked();

    void resumeTrading(String reason);
}
