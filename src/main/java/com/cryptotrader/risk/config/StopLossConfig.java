package com.cryptotrader.risk.config;

import java.math.BigDecimal;
import lombok.Builder;

/**
 * Fixed stop loss, as a percentage of entry price.
 *
 * @param percentage      loss that closes the position, in (0, 100)
 * @param cooldownSeconds minimum gap between two stop-loss triggers for the same symbol
 * @param trailing        reserved flag carried from configuration; trailing behaviour lives in
 *                        {@link TrailingStopConfig}
 */
@Builder(toBuilder = true)
public record StopLossConfig(boolean enabled, BigDecimal percentage, long cooldownSeconds, boolean trailing) {

    public StopLossConfig {
        ConfigChecks.requireOpenRange("stop_loss.percentage", percentage, 100);
        ConfigChecks.requireNonNegative("stop_loss.cooldown_seconds", cooldownSeconds);
    }
}
