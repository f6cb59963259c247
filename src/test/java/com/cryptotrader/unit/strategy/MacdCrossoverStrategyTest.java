package com.cryptotrader.unit.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cryptotrader.domain.enums.SignalAction;
import com.cryptotrader.domain.model.StrategySignal;
import com.cryptotrader.domain.vo.PluginParameters;
import com.cryptotrader.exception.ValidationException;
import com.cryptotrader.indicator.BarSeriesFactory;
import com.cryptotrader.strategy.MarketData;
import com.cryptotrader.strategy.impl.MacdCrossoverStrategy;
import com.cryptotrader.unit.support.CandleFixtures;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MacdCrossoverStrategyTest {

    private MacdCrossoverStrategy strategy;

    @BeforeEach
    void setUp() {
        strategy = new MacdCrossoverStrategy();
    }

    @Test
    @DisplayName("Jump after a decline is a bullish cross: BUY")
    void bullishCross() {
        StrategySignal signal = strategy.generateSignal(
                marketData(100, 99, 98, 97, 96, 95, 94, 93, 92, 91, 90, 110), fastParameters(false));

        assertThat(signal.getAction()).isEqualTo(SignalAction.BUY);
        assertThat(signal.getStrength()).isEqualTo(1.0);
        assertThat(signal.getMetadata()).containsEntry("reason", "bullish_cross_long_entry");
    }

    @Test
    @DisplayName("Drop after a rally is a bearish cross: SELL as long exit")
    void bearishCross_longExit() {
        StrategySignal signal = strategy.generateSignal(
                marketData(100, 101, 102, 103, 104, 105, 106, 107, 108, 109, 110, 90), fastParameters(false));

        assertThat(signal.getAction()).isEqualTo(SignalAction.SELL);
        assertThat(signal.getMetadata()).containsEntry("reason", "bearish_cross_long_exit");
    }

    @Test
    @DisplayName("With allow_short the bearish cross is a short entry")
    void bearishCross_shortEntry() {
        StrategySignal signal = strategy.generateSignal(
                marketData(100, 101, 102, 103, 104, 105, 106, 107, 108, 109, 110, 90), fastParameters(true));

        assertThat(signal.getAction()).isEqualTo(SignalAction.SELL);
        assertThat(signal.getMetadata()).containsEntry("reason", "bearish_cross_short_entry");
    }

    @Test
    @DisplayName("Flat prices hold without a cross")
    void flat_noCross() {
        StrategySignal signal = strategy.generateSignal(
                marketData(100, 100, 100, 100, 100, 100, 100, 100), fastParameters(false));

        assertThat(signal.getAction()).isEqualTo(SignalAction.HOLD);
        assertThat(signal.getMetadata()).containsEntry("reason", "no_cross");
    }

    @Test
    @DisplayName("A single bar is not enough data")
    void singleBar() {
        StrategySignal signal = strategy.generateSignal(marketData(100), fastParameters(false));

        assertThat(signal.getAction()).isEqualTo(SignalAction.HOLD);
        assertThat(signal.getMetadata()).containsEntry("reason", "insufficient_data");
    }

    @Test
    @DisplayName("Fast period must be below slow period")
    void invalidPeriods() {
        assertThatThrownBy(() -> strategy.validateParameters(PluginParameters.of(Map.of("fast", 30, "slow", 26))))
                .isInstanceOf(ValidationException.class);
    }

    private static MarketData marketData(double... closes) {
        return new MarketData(
                BarSeriesFactory.fromCandles("test", CandleFixtures.hourlyCloses(closes), Duration.ofHours(1)),
                Map.of());
    }

    private static PluginParameters fastParameters(boolean allowShort) {
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("fast", 2);
        parameters.put("slow", 3);
        parameters.put("signal", 2);
        parameters.put("allow_short", allowShort);
        return PluginParameters.of(parameters);
    }
}
