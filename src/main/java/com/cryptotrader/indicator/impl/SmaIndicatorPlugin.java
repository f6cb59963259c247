package com.cryptotrader.indicator.impl;

import com.cryptotrader.domain.vo.PluginParameters;
import com.cryptotrader.indicator.AbstractIndicatorPlugin;
import com.cryptotrader.indicator.IndicatorSeries;
import java.util.Map;
import org.ta4j.core.BarSeries;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;

public class SmaIndicatorPlugin extends AbstractIndicatorPlugin {

    public static final String NAME = "sma";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void validateParameters(PluginParameters parameters) {
        requireLength(parameters, "length", 20, 1);
    }

    @Override
    protected IndicatorSeries compute(BarSeries series, PluginParameters parameters) {
        SMAIndicator sma = new SMAIndicator(new ClosePriceIndicator(series), parameters.getInt("length", 20));
        return new IndicatorSeries(NAME, Map.of("sma", toColumn(sma, series)));
    }
}
