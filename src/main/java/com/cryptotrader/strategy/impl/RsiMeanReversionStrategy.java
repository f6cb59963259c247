package com.cryptotrader.strategy.impl;

import com.cryptotrader.domain.enums.SignalAction;
import com.cryptotrader.domain.model.StrategySignal;
import com.cryptotrader.domain.vo.PluginParameters;
import com.cryptotrader.exception.ValidationException;
import com.cryptotrader.indicator.impl.RsiIndicatorPlugin;
import com.cryptotrader.strategy.MarketData;
import com.cryptotrader.strategy.StrategyPlugin;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RSI mean reversion on the last two bars.
 *
 * <ul>
 *   <li>Long entry: RSI climbs back to or above {@code oversold} from below it</li>
 *   <li>Long exit: RSI crosses above {@code exit_overbought}</li>
 *   <li>Short entry (with {@code allow_short}): RSI falls back to or below {@code overbought}</li>
 *   <li>Short exit (with {@code allow_short}): RSI crosses below {@code exit_oversold}</li>
 * </ul>
 *
 * <p>Exits win over entries when both fire on the same bar.
 */
public class RsiMeanReversionStrategy implements StrategyPlugin {

    public static final String NAME = "rsi_mean_reversion";

    private final RsiIndicatorPlugin rsi = new RsiIndicatorPlugin();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void validateParameters(PluginParameters parameters) {
        Settings settings = Settings.from(parameters);
        if (settings.rsiLength < 2) {
            throw new ValidationException("rsi_length must be >= 2");
        }
        if (settings.oversold < 5.0 || settings.oversold >= 50.0) {
            throw new ValidationException("oversold must be in [5, 50)");
        }
        if (settings.overbought <= 50.0 || settings.overbought > 95.0) {
            throw new ValidationException("overbought must be in (50, 95]");
        }
        if (settings.exitOversold < settings.oversold) {
            throw new ValidationException("exit_oversold must be >= oversold");
        }
        if (settings.exitOverbought > settings.overbought) {
            throw new ValidationException("exit_overbought must be <= overbought");
        }
        if (settings.stopLossPct <= 0.0) {
            throw new ValidationException("stop_loss_pct must be > 0");
        }
        if (settings.takeProfitPct <= 0.0) {
            throw new ValidationException("take_profit_pct must be > 0");
        }
        if (settings.positionSizePct <= 0.0 || settings.positionSizePct > 100.0) {
            throw new ValidationException("position_size_pct must be in (0, 100]");
        }
    }

    @Override
    public StrategySignal generateSignal(MarketData marketData, PluginParameters parameters) {
        validateParameters(parameters);
        Settings settings = Settings.from(parameters);

        int bars = marketData.series().getBarCount();
        if (bars < 2) {
            return StrategySignal.hold("insufficient_data");
        }
        if (bars <= settings.rsiLength) {
            return StrategySignal.hold("warmup");
        }

        List<BigDecimal> values = rsi.calculate(
                        marketData.series(), PluginParameters.of(Map.of("length", settings.rsiLength)))
                .column("rsi");
        BigDecimal prev = values.get(values.size() - 2);
        BigDecimal curr = values.get(values.size() - 1);
        if (prev == null || curr == null) {
            return StrategySignal.hold("warmup");
        }
        double prevRsi = prev.doubleValue();
        double currRsi = curr.doubleValue();

        boolean longEntry = prevRsi < settings.oversold && currRsi >= settings.oversold;
        boolean longExit = prevRsi <= settings.exitOverbought && currRsi > settings.exitOverbought;
        boolean shortEntry = settings.allowShort && prevRsi > settings.overbought && currRsi <= settings.overbought;
        boolean shortExit = settings.allowShort && prevRsi >= settings.exitOversold && currRsi < settings.exitOversold;

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("rsi", currRsi);
        metadata.put("prev_rsi", prevRsi);
        metadata.put("params", settings.asMap());

        if (longExit) {
            return signal(SignalAction.SELL, metadata, "long_exit");
        }
        if (longEntry) {
            return signal(SignalAction.BUY, metadata, "long_entry");
        }
        if (shortExit) {
            return signal(SignalAction.BUY, metadata, "short_exit");
        }
        if (shortEntry) {
            return signal(SignalAction.SELL, metadata, "short_entry");
        }
        metadata.put("reason", "no_signal");
        return StrategySignal.builder()
                .action(SignalAction.HOLD)
                .strength(0.0)
                .metadata(metadata)
                .build();
    }

    private static StrategySignal signal(SignalAction action, Map<String, Object> metadata, String reason) {
        metadata.put("reason", reason);
        return StrategySignal.builder()
                .action(action)
                .strength(1.0)
                .metadata(metadata)
                .build();
    }

    private record Settings(
            int rsiLength,
            double oversold,
            double overbought,
            double exitOversold,
            double exitOverbought,
            boolean allowShort,
            double stopLossPct,
            double takeProfitPct,
            double positionSizePct) {

        static Settings from(PluginParameters parameters) {
            double oversold = parameters.getDouble("oversold", 30.0);
            double overbought = parameters.getDouble("overbought", 70.0);
            return new Settings(
                    parameters.getInt("rsi_length", 14),
                    oversold,
                    overbought,
                    parameters.getDouble("exit_oversold", oversold + 5.0),
                    parameters.getDouble("exit_overbought", overbought - 5.0),
                    parameters.getBoolean("allow_short", false),
                    parameters.getDouble("stop_loss_pct", 2.0),
                    parameters.getDouble("take_profit_pct", 4.0),
                    parameters.getDouble("position_size_pct", 10.0));
        }

        Map<String, Object> asMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("rsi_length", rsiLength);
            map.put("oversold", oversold);
            map.put("overbought", overbought);
            map.put("exit_oversold", exitOversold);
            map.put("exit_overbought", exitOverbought);
            map.put("allow_short", allowShort);
            map.put("stop_loss_pct", stopLossPct);
            map.put("take_profit_pct", takeProfitPct);
            map.put("position_size_pct", positionSizePct);
            return map;
        }
    }
}
