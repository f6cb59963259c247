package com.cryptotrader.risk;

import com.cryptotrader.domain.enums.RiskAction;
import com.cryptotrader.domain.model.Position;
import com.cryptotrader.oms.TradingEngine;
import java.math.BigDecimal;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns actionable risk evaluations into {@link TradingEngine} calls.
 *
 * <ul>
 *   <li>CLOSE_POSITION -> close the evaluated position</li>
 *   <li>REDUCE_POSITION -> close {@code partial_close_percentage} of it (50% when absent)</li>
 *   <li>EMERGENCY_EXIT_ALL -> close every position</li>
 *   <li>PAUSE_TRADING -> block new trades, for {@code pause_duration_seconds} if given</li>
 *   <li>BLOCK_NEW_TRADE -> logged only; the admission check already refused the trade</li>
 * </ul>
 *
 * <p>Failures from the trading engine are logged and rethrown so the monitor records
 * them against the callback.
 */
public class RiskActionHandler implements RiskActionCallback {

    private static final Logger log = LoggerFactory.getLogger(RiskActionHandler.class);

    static final BigDecimal DEFAULT_PARTIAL_CLOSE_PERCENTAGE = BigDecimal.valueOf(50);

    private final TradingEngine tradingEngine;

    public RiskActionHandler(TradingEngine tradingEngine) {
        this.tradingEngine = tradingEngine;
    }

    /** Registers this handler on the monitor for every actionable risk action. */
    public void registerWith(RiskMonitor riskMonitor) {
        for (RiskAction action : RiskAction.values()) {
            if (action != RiskAction.NONE) {
                riskMonitor.registerActionCallback(action, this);
            }
        }
    }

    @Override
    public void onRiskAction(RiskEvaluation evaluation) {
        if (!evaluation.isActionable()) {
            log.debug("No action required for evaluation {}", evaluation.getEvaluationId());
            return;
        }

        String target = evaluation.findPosition().map(Position::key).orElse("portfolio");
        log.info("Executing risk action {} for {}: {}", evaluation.getAction(), target, evaluation.getReason());
        try {
            switch (evaluation.getAction()) {
                case CLOSE_POSITION -> closePosition(evaluation);
                case REDUCE_POSITION -> reducePosition(evaluation);
                case EMERGENCY_EXIT_ALL -> tradingEngine.closeAllPositions(
                        evaluation.getReason(), evaluation.getEvaluationId());
                case PAUSE_TRADING -> tradingEngine.blockNewTrades(
                        pauseDuration(evaluation), evaluation.getReason(), evaluation.getEvaluationId());
                case BLOCK_NEW_TRADE -> log.info("Trade blocked for {}: {}", target, evaluation.getReason());
                default -> log.warn("Unhandled risk action {}", evaluation.getAction());
            }
            log.info("Risk action {} executed for {}", evaluation.getAction(), target);
        } catch (RuntimeException e) {
            log.error("Failed to execute risk action {} for {}: {}", evaluation.getAction(), target, e.getMessage());
            throw e;
        }
    }

    private void closePosition(RiskEvaluation evaluation) {
        Position position = evaluation.getPosition();
        if (position == null) {
            log.error("Cannot close position: evaluation {} has no position", evaluation.getEvaluationId());
            return;
        }
        tradingEngine.closePosition(
                position.getExchange(), position.getSymbol(), evaluation.getReason(), evaluation.getEvaluationId());
    }

    private void reducePosition(RiskEvaluation evaluation) {
        Position position = evaluation.getPosition();
        if (position == null) {
            log.error("Cannot reduce position: evaluation {} has no position", evaluation.getEvaluationId());
            return;
        }
        BigDecimal percentage = toDecimal(evaluation.getMetadata().get("partial_close_percentage"));
        if (percentage == null) {
            log.warn(
                    "No partial_close_percentage on evaluation {}, reducing {} by {}%",
                    evaluation.getEvaluationId(),
                    position.key(),
                    DEFAULT_PARTIAL_CLOSE_PERCENTAGE);
            percentage = DEFAULT_PARTIAL_CLOSE_PERCENTAGE;
        }
        tradingEngine.partialClosePosition(
                position.getExchange(),
                position.getSymbol(),
                percentage,
                evaluation.getReason(),
                evaluation.getEvaluationId());
    }

    private static Duration pauseDuration(RiskEvaluation evaluation) {
        BigDecimal seconds = toDecimal(evaluation.getMetadata().get("pause_duration_seconds"));
        return seconds == null ? null : Duration.ofSeconds(seconds.longValue());
    }

    private static BigDecimal toDecimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        return new BigDecimal(value.toString());
    }
}
