package com.cryptotrader.indicator.impl;

import com.cryptotrader.domain.vo.PluginParameters;
import com.cryptotrader.exception.ValidationException;
import com.cryptotrader.indicator.AbstractIndicatorPlugin;
import com.cryptotrader.indicator.IndicatorSeries;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.ta4j.core.BarSeries;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsLowerIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsMiddleIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsUpperIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.statistics.StandardDeviationIndicator;
import org.ta4j.core.num.Num;

/** Bollinger bands. Parameters: {@code length} (20) and {@code std} multiplier (2.0). */
public class BollingerBandsIndicatorPlugin extends AbstractIndicatorPlugin {

    public static final String NAME = "bbands";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void validateParameters(PluginParameters parameters) {
        requireLength(parameters, "length", 20, 2);
        if (parameters.getDouble("std", 2.0) <= 0) {
            throw new ValidationException("Parameter 'std' must be positive");
        }
    }

    @Override
    protected IndicatorSeries compute(BarSeries series, PluginParameters parameters) {
        int length = parameters.getInt("length", 20);
        Num k = series.numOf(parameters.getDouble("std", 2.0));

        ClosePriceIndicator close = new ClosePriceIndicator(series);
        BollingerBandsMiddleIndicator middle = new BollingerBandsMiddleIndicator(new SMAIndicator(close, length));
        StandardDeviationIndicator deviation = new StandardDeviationIndicator(close, length);

        Map<String, List<BigDecimal>> columns = new LinkedHashMap<>();
        columns.put("lower", toColumn(new BollingerBandsLowerIndicator(middle, deviation, k), series));
        columns.put("middle", toColumn(middle, series));
        columns.put("upper", toColumn(new BollingerBandsUpperIndicator(middle, deviation, k), series));
        return new IndicatorSeries(NAME, columns);
    }
}
