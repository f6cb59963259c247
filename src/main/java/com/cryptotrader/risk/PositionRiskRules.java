package com.cryptotrader.risk;

import com.cryptotrader.domain.enums.OrderSide;
import com.cryptotrader.domain.enums.RiskAction;
import com.cryptotrader.domain.model.Position;
import com.cryptotrader.risk.config.StopLossConfig;
import com.cryptotrader.risk.config.TakeProfitConfig;
import com.cryptotrader.risk.config.TrailingStopConfig;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure position-level rules: stop loss, take profit and trailing stop.
 *
 * <p>Rules never throw and never touch engine state. Cooldowns are applied by
 * {@link RiskEngine} on top of an actionable result. Percentages are side-aware:
 * a SELL position loses when price rises above entry.
 */
public final class PositionRiskRules {

    public static final String STOP_LOSS = "stop_loss";
    public static final String TAKE_PROFIT = "take_profit";
    public static final String TRAILING_STOP = "trailing_stop";

    static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private PositionRiskRules() {}

    public static RiskEvaluation stopLoss(Position position, StopLossConfig config, Instant now) {
        if (!config.enabled()) {
            return RiskEvaluation.none("Stop loss disabled", now);
        }
        if (!hasPrices(position)) {
            return RiskEvaluation.none("Position has no entry or current price", now);
        }

        BigDecimal lossPct = profitPercent(position).negate();
        if (lossPct.compareTo(config.percentage()) >= 0) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("loss_pct", lossPct);
            return RiskEvaluation.of(
                    RiskAction.CLOSE_POSITION,
                    "Stop loss triggered: " + format(lossPct) + "% loss",
                    List.of(STOP_LOSS),
                    position,
                    metadata,
                    now);
        }
        return RiskEvaluation.none("Stop loss not triggered", now);
    }

    public static RiskEvaluation takeProfit(Position position, TakeProfitConfig config, Instant now) {
        if (!config.enabled()) {
            return RiskEvaluation.none("Take profit disabled", now);
        }
        if (!hasPrices(position)) {
            return RiskEvaluation.none("Position has no entry or current price", now);
        }

        BigDecimal profitPct = profitPercent(position);
        if (profitPct.compareTo(config.percentage()) < 0) {
            return RiskEvaluation.none("Take profit not triggered", now);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("profit_pct", profitPct);
        metadata.put("partial", config.partialClose());
        if (config.partialClose()) {
            // both keys: partial_pct describes the rule, partial_close_percentage is read by the action handler
            metadata.put("partial_pct", config.partialClosePercentage());
            metadata.put("partial_close_percentage", config.partialClosePercentage());
            return RiskEvaluation.of(
                    RiskAction.REDUCE_POSITION,
                    "Take profit triggered: " + format(profitPct) + "% profit, reducing by "
                            + config.partialClosePercentage().stripTrailingZeros().toPlainString() + "%",
                    List.of(TAKE_PROFIT),
                    position,
                    metadata,
                    now);
        }
        return RiskEvaluation.of(
                RiskAction.CLOSE_POSITION,
                "Take profit triggered: " + format(profitPct) + "% profit",
                List.of(TAKE_PROFIT),
                position,
                metadata,
                now);
    }

    public static RiskEvaluation trailingStop(Position position, TrailingStopConfig config, Instant now) {
        if (!config.enabled()) {
            return RiskEvaluation.none("Trailing stop disabled", now);
        }
        if (position.getHighestPrice() == null || position.getHighestPrice().signum() <= 0) {
            return RiskEvaluation.none("Highest price not set", now);
        }
        if (!hasPrices(position)) {
            return RiskEvaluation.none("Position has no entry or current price", now);
        }

        BigDecimal profitPct = profitPercent(position);
        if (profitPct.compareTo(config.activationPercentage()) < 0) {
            return RiskEvaluation.none("Trailing stop not yet activated", now);
        }

        BigDecimal best = position.getHighestPrice();
        BigDecimal retrace = position.getSide() == OrderSide.SELL
                ? position.getCurrentPrice().subtract(best)
                : best.subtract(position.getCurrentPrice());
        BigDecimal retracePct = retrace.divide(best, MathContext.DECIMAL64).multiply(HUNDRED);

        if (retracePct.compareTo(config.trailingPercentage()) >= 0) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("profit_pct", profitPct);
            metadata.put("drop_from_peak_pct", retracePct);
            metadata.put("highest_price", best);
            return RiskEvaluation.of(
                    RiskAction.CLOSE_POSITION,
                    "Trailing stop triggered: " + format(retracePct) + "% drop from peak",
                    List.of(TRAILING_STOP),
                    position,
                    metadata,
                    now);
        }
        return RiskEvaluation.none("Trailing stop not triggered", now);
    }

    /** Profit relative to entry, in percent; negative when the position is losing. */
    static BigDecimal profitPercent(Position position) {
        BigDecimal entry = position.getEntryPrice();
        BigDecimal move = position.getSide() == OrderSide.SELL
                ? entry.subtract(position.getCurrentPrice())
                : position.getCurrentPrice().subtract(entry);
        return move.divide(entry, MathContext.DECIMAL64).multiply(HUNDRED);
    }

    static String format(BigDecimal percent) {
        return percent.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static boolean hasPrices(Position position) {
        return position.getEntryPrice() != null
                && position.getEntryPrice().signum() > 0
                && position.getCurrentPrice() != null;
    }
}
