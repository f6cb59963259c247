package com.cryptotrader.risk.config;

import com.cryptotrader.exception.ValidationException;
import java.time.Duration;
import lombok.Builder;

/**
 * Complete, validated risk configuration. Instances are immutable; a changed
 * setting is applied by building a new instance ({@code toBuilder()}) and handing
 * it to {@code RiskEngine.updateConfig}.
 */
@Builder(toBuilder = true)
public record RiskConfig(
        StopLossConfig stopLoss,
        TakeProfitConfig takeProfit,
        ExposureLimitConfig exposureLimits,
        TrailingStopConfig trailingStop,
        MaxConcurrentTradesConfig maxConcurrentTrades,
        DrawdownControlConfig drawdownControl,
        Duration riskCheckInterval,
        boolean emergencyOnlyMode) {

    public RiskConfig {
        ConfigChecks.requireNonNull("stop_loss", stopLoss);
        ConfigChecks.requireNonNull("take_profit", takeProfit);
        ConfigChecks.requireNonNull("exposure_limits", exposureLimits);
        ConfigChecks.requireNonNull("trailing_stop", trailingStop);
        ConfigChecks.requireNonNull("max_concurrent_trades", maxConcurrentTrades);
        ConfigChecks.requireNonNull("drawdown_control", drawdownControl);
        if (riskCheckInterval == null) {
            riskCheckInterval = Duration.ofSeconds(1);
        }
        if (riskCheckInterval.isZero() || riskCheckInterval.isNegative()) {
            throw new ValidationException("risk_check_interval must be positive, got " + riskCheckInterval);
        }
        if (stopLoss.enabled()
                && takeProfit.enabled()
                && stopLoss.percentage().compareTo(takeProfit.percentage()) >= 0) {
            throw new ValidationException("stop_loss.percentage (" + stopLoss.percentage()
                    + ") must be less than take_profit.percentage (" + takeProfit.percentage() + ")");
        }
    }
}
