package com.cryptotrader.indicator;

import com.cryptotrader.domain.vo.PluginParameters;
import org.ta4j.core.BarSeries;

/**
 * A technical indicator that can be configured per strategy and computed over a bar series.
 * Instances are created per calculation by {@link IndicatorRegistry} and hold no state.
 */
public interface IndicatorPlugin {

    String name();

    /** @throws com.cryptotrader.exception.ValidationException if the parameters are unusable */
    void validateParameters(PluginParameters parameters);

    IndicatorSeries calculate(BarSeries series, PluginParameters parameters);
}
