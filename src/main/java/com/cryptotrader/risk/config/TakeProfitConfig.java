package com.cryptotrader.risk.config;

import com.cryptotrader.exception.ValidationException;
import java.math.BigDecimal;
import lombok.Builder;

/**
 * Take profit, as a percentage of entry price. With {@code partialClose} the rule
 * reduces the position by {@code partialClosePercentage} instead of closing it.
 */
@Builder(toBuilder = true)
public record TakeProfitConfig(
        boolean enabled,
        BigDecimal percentage,
        long cooldownSeconds,
        boolean partialClose,
        BigDecimal partialClosePercentage) {

    public TakeProfitConfig {
        ConfigChecks.requireOpenRange("take_profit.percentage", percentage, 1000);
        ConfigChecks.requireNonNegative("take_profit.cooldown_seconds", cooldownSeconds);
        if (partialClose && partialClosePercentage == null) {
            throw new ValidationException(
                    "take_profit.partial_close_percentage is required when partial_close is enabled");
        }
        if (partialClosePercentage != null) {
            ConfigChecks.requireHalfOpenRange("take_profit.partial_close_percentage", partialClosePercentage, 100);
        }
    }
}
