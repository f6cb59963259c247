package com.cryptotrader.strategy.impl;

import com.cryptotrader.domain.enums.SignalAction;
import com.cryptotrader.domain.model.StrategySignal;
import com.cryptotrader.domain.vo.PluginParameters;
import com.cryptotrader.indicator.IndicatorSeries;
import com.cryptotrader.indicator.impl.MacdIndicatorPlugin;
import com.cryptotrader.strategy.MarketData;
import com.cryptotrader.strategy.StrategyPlugin;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Trades crossovers of the MACD line and its signal line.
 *
 * <ul>
 *   <li>Bullish cross (MACD moves above signal): BUY, long entry</li>
 *   <li>Bearish cross (MACD moves below signal): SELL, long exit, or short entry when
 *       {@code allow_short} is set</li>
 * </ul>
 *
 * <p>Parameters: {@code fast} (12), {@code slow} (26), {@code signal} (9), {@code allow_short} (false).
 */
public class MacdCrossoverStrategy implements StrategyPlugin {

    public static final String NAME = "macd_crossover";

    private final MacdIndicatorPlugin macd = new MacdIndicatorPlugin();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void validateParameters(PluginParameters parameters) {
        macd.validateParameters(parameters);
        parameters.getBoolean("allow_short", false);
    }

    @Override
    public StrategySignal generateSignal(MarketData marketData, PluginParameters parameters) {
        validateParameters(parameters);
        if (marketData.series().getBarCount() < 2) {
            return StrategySignal.hold("insufficient_data");
        }

        int fast = parameters.getInt("fast", 12);
        int slow = parameters.getInt("slow", 26);
        int signalLength = parameters.getInt("signal", 9);
        boolean allowShort = parameters.getBoolean("allow_short", false);

        IndicatorSeries values = macd.calculate(
                marketData.series(), PluginParameters.of(Map.of("fast", fast, "slow", slow, "signal", signalLength)));
        List<BigDecimal> macdLine = values.column("macd");
        List<BigDecimal> signalLine = values.column("signal");
        int last = macdLine.size() - 1;
        BigDecimal prevMacd = macdLine.get(last - 1);
        BigDecimal currMacd = macdLine.get(last);
        BigDecimal prevSignal = signalLine.get(last - 1);
        BigDecimal currSignal = signalLine.get(last);
        if (prevMacd == null || currMacd == null || prevSignal == null || currSignal == null) {
            return StrategySignal.hold("warmup");
        }

        boolean bullishCross = prevMacd.compareTo(prevSignal) <= 0 && currMacd.compareTo(currSignal) > 0;
        boolean bearishCross = prevMacd.compareTo(prevSignal) >= 0 && currMacd.compareTo(currSignal) < 0;

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("macd", currMacd.doubleValue());
        metadata.put("signal", currSignal.doubleValue());
        metadata.put("fast", fast);
        metadata.put("slow", slow);
        metadata.put("signal_len", signalLength);
        metadata.put("allow_short", allowShort);

        if (bearishCross) {
            metadata.put("reason", allowShort ? "bearish_cross_short_entry" : "bearish_cross_long_exit");
            return signal(SignalAction.SELL, 1.0, metadata);
        }
        if (bullishCross) {
            metadata.put("reason", "bullish_cross_long_entry");
            return signal(SignalAction.BUY, 1.0, metadata);
        }
        metadata.put("reason", "no_cross");
        return signal(SignalAction.HOLD, 0.0, metadata);
    }

    private static StrategySignal signal(SignalAction action, double strength, Map<String, Object> metadata) {
        return StrategySignal.builder()
                .action(action)
                .strength(strength)
                .metadata(metadata)
                .build();
    }
}
