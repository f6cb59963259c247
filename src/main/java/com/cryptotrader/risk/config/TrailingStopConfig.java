package com.cryptotrader.risk.config;

import com.cryptotrader.exception.ValidationException;
import java.math.BigDecimal;
import lombok.Builder;

/**
 * Trailing stop. The stop arms once profit reaches {@code activationPercentage} and
 * fires when price retraces {@code trailingPercentage} from the best price seen.
 */
@Builder(toBuilder = true)
public record TrailingStopConfig(
        boolean enabled,
        BigDecimal trailingPercentage,
        BigDecimal activationPercentage,
        long cooldownSeconds) {

    public TrailingStopConfig {
        ConfigChecks.requireOpenRange("trailing_stop.trailing_percentage", trailingPercentage, 100);
        ConfigChecks.requireOpenRange("trailing_stop.activation_percentage", activationPercentage, 1000);
        if (activationPercentage.compareTo(trailingPercentage) <= 0) {
            throw new ValidationException("trailing_stop.activation_percentage (" + activationPercentage
                    + ") must be greater than trailing_percentage (" + trailingPercentage + ")");
        }
        ConfigChecks.requireNonNegative("trailing_stop.cooldown_seconds", cooldownSeconds);
    }
}
