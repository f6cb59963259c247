package com.cryptotrader.risk.config;

import com.cryptotrader.exception.ValidationException;
import java.math.BigDecimal;
import lombok.Builder;

/**
 * Equity drawdown limits measured from peak equity. Crossing {@code maxDrawdownPercentage}
 * pauses trading; crossing {@code emergencyExitPercentage} exits every position.
 */
@Builder(toBuilder = true)
public record DrawdownControlConfig(
        BigDecimal maxDrawdownPercentage,
        boolean enableEmergencyExit,
        BigDecimal emergencyExitPercentage,
        boolean pauseTradingOnBreach,
        int calculationPeriodDays) {

    public DrawdownControlConfig {
        ConfigChecks.requireOpenRange("drawdown_control.max_drawdown_percentage", maxDrawdownPercentage, 100);
        ConfigChecks.requireOpenRange("drawdown_control.emergency_exit_percentage", emergencyExitPercentage, 100);
        if (enableEmergencyExit && emergencyExitPercentage.compareTo(maxDrawdownPercentage) <= 0) {
            throw new ValidationException("drawdown_control.emergency_exit_percentage (" + emergencyExitPercentage
                    + ") must be greater than max_drawdown_percentage (" + maxDrawdownPercentage + ")");
        }
        if (calculationPeriodDays == 0) {
            calculationPeriodDays = 30;
        }
        ConfigChecks.requirePositive("drawdown_control.calculation_period_days", calculationPeriodDays);
    }
}
