package com.cryptotrader.indicator.impl;

import com.cryptotrader.domain.vo.PluginParameters;
import com.cryptotrader.indicator.AbstractIndicatorPlugin;
import com.cryptotrader.indicator.IndicatorSeries;
import java.util.Map;
import org.ta4j.core.BarSeries;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;

public class EmaIndicatorPlugin extends AbstractIndicatorPlugin {

    public static final String NAME = "ema";

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
        EMAIndicator ema = new EMAIndicator(new ClosePriceIndicator(series), parameters.getInt("length", 20));
        return new IndicatorSeries(NAME, Map.of("ema", toColumn(ema, series)));
    }
}
