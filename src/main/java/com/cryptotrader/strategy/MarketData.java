package com.cryptotrader.strategy;

import com.cryptotrader.indicator.IndicatorSeries;
import java.util.Map;
import java.util.Optional;
import org.ta4j.core.BarSeries;

/**
 * Input handed to a strategy plugin: the bar series for its symbol and timeframe,
 * plus the indicators configured for the strategy keyed by indicator name. Indicators
 * that failed to calculate are absent.
 */
public record MarketData(BarSeries series, Map<String, IndicatorSeries> indicators) {

    public MarketData {
        indicators = Map.copyOf(indicators);
    }

    public Optional<IndicatorSeries> indicator(String name) {
        return Optional.ofNullable(indicators.get(name));
    }
}
