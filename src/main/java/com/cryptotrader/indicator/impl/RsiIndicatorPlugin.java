package com.cryptotrader.indicator.impl;

import com.cryptotrader.domain.vo.PluginParameters;
import com.cryptotrader.indicator.AbstractIndicatorPlugin;
import com.cryptotrader.indicator.IndicatorSeries;
import java.util.Map;
import org.ta4j.core.BarSeries;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;

/** Relative strength index of close prices. Parameter: {@code length} (default 14, at least 2). */
public class RsiIndicatorPlugin extends AbstractIndicatorPlugin {

    public static final String NAME = "rsi";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void validateParameters(PluginParameters parameters) {
        requireLength(parameters, "length", 14, 2);
    }

    @Override
    protected IndicatorSeries compute(BarSeries series, PluginParameters parameters) {
        int length = parameters.getInt("length", 14);
        RSIIndicator rsi = new RSIIndicator(new ClosePriceIndicator(series), length);
        return new IndicatorSeries(NAME, Map.of("rsi", toColumn(rsi, series)));
    }
}
