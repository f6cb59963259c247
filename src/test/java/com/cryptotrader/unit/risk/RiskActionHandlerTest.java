package com.cryptotrader.unit.risk;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.cryptotrader.domain.enums.OrderSide;
import com.cryptotrader.domain.enums.RiskAction;
import com.cryptotrader.oms.TradingEngine;
import com.cryptotrader.risk.RiskActionHandler;
import com.cryptotrader.risk.RiskEvaluation;
import com.cryptotrader.unit.support.RiskFixtures;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RiskActionHandlerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private TradingEngine tradingEngine;

    private RiskActionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new RiskActionHandler(tradingEngine);
    }

    @Test
    @DisplayName("CLOSE_POSITION closes the evaluated position with the evaluation id")
    void closePosition() {
        RiskEvaluation evaluation = positionEvaluation(RiskAction.CLOSE_POSITION, Map.of());

        handler.onRiskAction(evaluation);

        verify(tradingEngine)
                .closePosition("binance", "BTC/USDT", "test reason", evaluation.getEvaluationId());
    }

    @Test
    @DisplayName("REDUCE_POSITION passes the partial close percentage through")
    void reducePosition() {
        RiskEvaluation evaluation = positionEvaluation(
                RiskAction.REDUCE_POSITION, Map.of("partial_close_percentage", new BigDecimal("30")));

        handler.onRiskAction(evaluation);

        verify(tradingEngine).partialClosePosition(
                "binance", "BTC/USDT", new BigDecimal("30"), "test reason", evaluation.getEvaluationId());
    }

    @Test
    @DisplayName("REDUCE_POSITION without a percentage reduces by half")
    void reducePositionDefault() {
        RiskEvaluation evaluation = positionEvaluation(RiskAction.REDUCE_POSITION, Map.of());

        handler.onRiskAction(evaluation);

        verify(tradingEngine).partialClosePosition(
                eq("binance"), eq("BTC/USDT"), eq(BigDecimal.valueOf(50)), anyString(), anyString());
    }

    @Test
    @DisplayName("EMERGENCY_EXIT_ALL closes every position")
    void emergencyExit() {
        RiskEvaluation evaluation = portfolioEvaluation(RiskAction.EMERGENCY_EXIT_ALL, Map.of());

        handler.onRiskAction(evaluation);

        verify(tradingEngine).closeAllPositions("test reason", evaluation.getEvaluationId());
    }

    @Test
    @DisplayName("PAUSE_TRADING blocks indefinitely unless a duration is given")
    void pauseTrading() {
        handler.onRiskAction(portfolioEvaluation(RiskAction.PAUSE_TRADING, Map.of()));
        verify(tradingEngine).blockNewTrades(isNull(), eq("test reason"), anyString());

        handler.onRiskAction(portfolioEvaluation(RiskAction.PAUSE_TRADING, Map.of("pause_duration_seconds", 300)));
        verify(tradingEngine).blockNewTrades(eq(Duration.ofSeconds(300)), eq("test reason"), anyString());
    }

    @Test
    @DisplayName("BLOCK_NEW_TRADE and NONE leave the trading engine alone")
    void blockAndNone_noCalls() {
        handler.onRiskAction(positionEvaluation(RiskAction.BLOCK_NEW_TRADE, Map.of()));
        handler.onRiskAction(RiskEvaluation.none("fine", NOW));

        verifyNoInteractions(tradingEngine);
    }

    @Test
    @DisplayName("Trading engine failures propagate to the monitor")
    void failurePropagates() {
        when(tradingEngine.closeAllPositions(anyString(), anyString()))
                .thenThrow(new IllegalStateException("exchange down"));

        assertThatThrownBy(() -> handler.onRiskAction(portfolioEvaluation(RiskAction.EMERGENCY_EXIT_ALL, Map.of())))
                .isInstanceOf(IllegalStateException.class);
        verify(tradingEngine).closeAllPositions(anyString(), any());
    }

    private static RiskEvaluation positionEvaluation(RiskAction action, Map<String, Object> metadata) {
        return RiskEvaluation.of(
                action,
                "test reason",
                List.of("rule"),
                RiskFixtures.position(OrderSide.BUY, "50000", "48000"),
                metadata,
                NOW);
    }

    private static RiskEvaluation portfolioEvaluation(RiskAction action, Map<String, Object> metadata) {
        return RiskEvaluation.of(action, "test reason", List.of("rule"), null, metadata, NOW);
    }
}
