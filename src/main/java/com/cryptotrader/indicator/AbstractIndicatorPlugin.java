package com.cryptotrader.indicator;

import com.cryptotrader.domain.vo.PluginParameters;
import com.cryptotrader.exception.ValidationException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.ta4j.core.BarSeries;
import org.ta4j.core.Indicator;
import org.ta4j.core.num.Num;

/** Shared parameter checks and ta4j-to-column conversion for the built-in indicators. */
public abstract class AbstractIndicatorPlugin implements IndicatorPlugin {

    @Override
    public IndicatorSeries calculate(BarSeries series, PluginParameters parameters) {
        validateParameters(parameters);
        if (series.isEmpty()) {
            throw new ValidationException("Cannot calculate " + name() + " on an empty series");
        }
        return compute(series, parameters);
    }

    protected abstract IndicatorSeries compute(BarSeries series, PluginParameters parameters);

    protected static int requireLength(PluginParameters parameters, String key, int defaultValue, int minimum) {
        int value = parameters.getInt(key, defaultValue);
        if (value < minimum) {
            throw new ValidationException("Parameter '" + key + "' must be at least " + minimum + ", got " + value);
        }
        return value;
    }

    /** Values for every bar of the series; NaN becomes null. */
    protected static List<BigDecimal> toColumn(Indicator<Num> indicator, BarSeries series) {
        List<BigDecimal> values = new ArrayList<>(series.getBarCount());
        for (int i = series.getBeginIndex(); i <= series.getEndIndex(); i++) {
            values.add(toDecimal(indicator.getValue(i)));
        }
        return values;
    }

    protected static BigDecimal toDecimal(Num num) {
        if (num == null || num.isNaN()) {
            return null;
        }
        double value = num.doubleValue();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return null;
        }
        return BigDecimal.valueOf(value);
    }
}
