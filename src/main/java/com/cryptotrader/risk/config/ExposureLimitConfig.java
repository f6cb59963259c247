package com.cryptotrader.risk.config;

import com.cryptotrader.exception.ValidationException;
import java.math.BigDecimal;
import lombok.Builder;

/** Notional exposure caps in {@code baseCurrency}: per asset, per exchange and in total. */
@Builder(toBuilder = true)
public record ExposureLimitConfig(
        BigDecimal maxPerAsset, BigDecimal maxPerExchange, BigDecimal maxTotal, String baseCurrency) {

    public ExposureLimitConfig {
        ConfigChecks.requirePositive("exposure_limits.max_per_asset", maxPerAsset);
        ConfigChecks.requirePositive("exposure_limits.max_per_exchange", maxPerExchange);
        ConfigChecks.requirePositive("exposure_limits.max_total", maxTotal);
        if (maxPerAsset.compareTo(maxPerExchange) > 0) {
            throw new ValidationException("exposure_limits.max_per_asset (" + maxPerAsset
                    + ") cannot exceed max_per_exchange (" + maxPerExchange + ")");
        }
        if (maxPerExchange.compareTo(maxTotal) > 0) {
            throw new ValidationException("exposure_limits.max_per_exchange (" + maxPerExchange
                    + ") cannot exceed max_total (" + maxTotal + ")");
        }
        if (baseCurrency == null || baseCurrency.isBlank()) {
            baseCurrency = "USDT";
        }
    }
}
