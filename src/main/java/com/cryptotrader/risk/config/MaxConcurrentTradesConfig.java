package com.cryptotrader.risk.config;

import com.cryptotrader.exception.ValidationException;
import lombok.Builder;

/** Caps on the number of simultaneously open positions. */
@Builder(toBuilder = true)
public record MaxConcurrentTradesConfig(int maxTrades, int maxPerAsset, int maxPerExchange) {

    public MaxConcurrentTradesConfig {
        ConfigChecks.requirePositive("max_concurrent_trades.max_trades", maxTrades);
        ConfigChecks.requirePositive("max_concurrent_trades.max_per_asset", maxPerAsset);
        ConfigChecks.requirePositive("max_concurrent_trades.max_per_exchange", maxPerExchange);
        if (maxPerExchange > maxTrades) {
            throw new ValidationException("max_concurrent_trades.max_per_exchange (" + maxPerExchange
                    + ") cannot exceed max_trades (" + maxTrades + ")");
        }
    }
}
