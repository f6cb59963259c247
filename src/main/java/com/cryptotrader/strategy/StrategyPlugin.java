package com.cryptotrader.strategy;

import com.cryptotrader.domain.model.StrategySignal;
import com.cryptotrader.domain.vo.PluginParameters;

/**
 * A signal-generating trading strategy. A new instance is created for every run by
 * {@link StrategyPluginRegistry}; plugins may keep state between the bars of one run
 * and must drop it in {@link #resetState()}.
 */
public interface StrategyPlugin {

    String name();

    /** @throws com.cryptotrader.exception.ValidationException if the parameters are unusable */
    void validateParameters(PluginParameters parameters);

    StrategySignal generateSignal(MarketData marketData, PluginParameters parameters);

    default void resetState() {}
}
