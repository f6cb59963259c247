package com.cryptotrader.indicator.impl;

import com.cryptotrader.domain.vo.PluginParameters;
import com.cryptotrader.exception.ValidationException;
import com.cryptotrader.indicator.AbstractIndicatorPlugin;
import com.cryptotrader.indicator.IndicatorSeries;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.ta4j.core.BarSeries;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.MACDIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;

/**
 * MACD line, signal line and histogram of close prices.
 * Parameters: {@code fast} (12), {@code slow} (26), {@code signal} (9); fast must be below slow.
 */
public class MacdIndicatorPlugin extends AbstractIndicatorPlugin {

    public static final String NAME = "macd";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void validateParameters(PluginParameters parameters) {
        int fast = requireLength(parameters, "fast", 12, 1);
        int slow = requireLength(parameters, "slow", 26, 1);
        requireLength(parameters, "signal", 9, 1);
        if (fast >= slow) {
            throw new ValidationException(
                    "MACD fast period (" + fast + ") must be less than slow period (" + slow + ")");
        }
    }

    @Override
    protected IndicatorSeries compute(BarSeries series, PluginParameters parameters) {
        MACDIndicator macd = new MACDIndicator(
                new ClosePriceIndicator(series), parameters.getInt("fast", 12), parameters.getInt("slow", 26));
        EMAIndicator signal = new EMAIndicator(macd, parameters.getInt("signal", 9));

        List<BigDecimal> macdValues = toColumn(macd, series);
        List<BigDecimal> signalValues = toColumn(signal, series);
        List<BigDecimal> histogram = new ArrayList<>(macdValues.size());
        for (int i = 0; i < macdValues.size(); i++) {
            BigDecimal m = macdValues.get(i);
            BigDecimal s = signalValues.get(i);
            histogram.add(m == null || s == null ? null : m.subtract(s));
        }

        Map<String, List<BigDecimal>> columns = new LinkedHashMap<>();
        columns.put("macd", macdValues);
        columns.put("signal", signalValues);
        columns.put("histogram", histogram);
        return new IndicatorSeries(NAME, columns);
    }
}
