package com.cryptotrader.indicator.impl;

import com.cryptotrader.domain.vo.PluginParameters;
import com.cryptotrader.indicator.AbstractIndicatorPlugin;
import com.cryptotrader.indicator.IndicatorSeries;
import java.util.Map;
import org.ta4j.core.BarSeries;
import org.ta4j.core.indicators.ATRIndicator;

/** Average true range. Parameter: {@code length} (default 14). */
public class AtrIndicatorPlugin extends AbstractIndicatorPlugin {

    public static final String NAME = "atr";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void validateParameters(PluginParameters parameters) {
        requireLength(parameters, "length", 14, 1);
    }

    @Override
    protected IndicatorSeries compute(BarSeries series, PluginParameters parameters) {
        ATRIndicator atr = new ATRIndicator(series, parameters.getInt("length", 14));
        return new IndicatorSeries(NAME, Map.of("atr", toColumn(atr, series)));
    }
}
