package com.cryptotrader.unit.indicator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cryptotrader.domain.vo.PluginParameters;
import com.cryptotrader.indicator.BarSeriesFactory;
import com.cryptotrader.indicator.IndicatorCache;
import com.cryptotrader.indicator.IndicatorSeries;
import com.cryptotrader.unit.support.CandleFixtures;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.ta4j.core.BarSeries;

class IndicatorCacheTest {

    private IndicatorCache cache;
    private BarSeries series;
    private AtomicInteger calculations;

    @BeforeEach
    void setUp() {
        cache = new IndicatorCache(2);
        series = BarSeriesFactory.fromCandles(
                "binance:BTC/USDT:1h", CandleFixtures.hourly(20, 100, 1), Duration.ofHours(1));
        calculations = new AtomicInteger();
    }

    @Test
    @DisplayName("Same indicator, series and parameters is served from the cache")
    void hit() {
        PluginParameters parameters = PluginParameters.of(Map.of("length", 14));

        IndicatorSeries first = cache.getOrCompute("rsi", series, parameters, counting("rsi"));
        IndicatorSeries second = cache.getOrCompute("rsi", series, parameters, counting("rsi"));

        assertThat(second).isSameAs(first);
        assertThat(calculations.get()).isEqualTo(1);
        assertThat(cache.getStats().hits()).isEqualTo(1);
        assertThat(cache.getStats().misses()).isEqualTo(1);
        assertThat(cache.getStats().hitRate()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Different parameters or a new candle are misses")
    void parameterAndSeriesChangesMiss() {
        cache.getOrCompute("rsi", series, PluginParameters.of(Map.of("length", 14)), counting("rsi"));
        cache.getOrCompute("rsi", series, PluginParameters.of(Map.of("length", 7)), counting("rsi"));

        BarSeries extended = BarSeriesFactory.fromCandles(
                "binance:BTC/USDT:1h", CandleFixtures.hourly(21, 100, 1), Duration.ofHours(1));
        cache.getOrCompute("rsi", extended, PluginParameters.of(Map.of("length", 14)), counting("rsi"));

        assertThat(calculations.get()).isEqualTo(3);
        assertThat(cache.getStats().hits()).isZero();
    }

    @Test
    @DisplayName("Parameter order does not affect the cache key")
    void parameterOrderIrrelevant() {
        Map<String, Object> ab = new LinkedHashMap<>();
        ab.put("fast", 12);
        ab.put("slow", 26);
        Map<String, Object> ba = new LinkedHashMap<>();
        ba.put("slow", 26);
        ba.put("fast", 12);

        cache.getOrCompute("macd", series, PluginParameters.of(ab), counting("macd"));
        cache.getOrCompute("macd", series, PluginParameters.of(ba), counting("macd"));

        assertThat(calculations.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Identical candles on two markets are cached separately")
    void sameCandlesDifferentMarket_miss() {
        BarSeries eth = BarSeriesFactory.fromCandles(
                "binance:ETH/USDT:1h", CandleFixtures.hourly(20, 100, 1), Duration.ofHours(1));
        PluginParameters parameters = PluginParameters.of(Map.of("length", 14));

        IndicatorSeries btcRsi = cache.getOrCompute("rsi", series, parameters, counting("rsi-btc"));
        IndicatorSeries ethRsi = cache.getOrCompute("rsi", eth, parameters, counting("rsi-eth"));

        assertThat(ethRsi).isNotSameAs(btcRsi);
        assertThat(calculations.get()).isEqualTo(2);
        assertThat(cache.getStats().misses()).isEqualTo(2);
    }

    @Test
    @DisplayName("A revised last close with the same bar count is a miss")
    void revisedLastClose_miss() {
        PluginParameters parameters = PluginParameters.of(Map.of("length", 14));
        BarSeries revised = BarSeriesFactory.fromCandles(
                "binance:BTC/USDT:1h", CandleFixtures.hourly(20, 101, 1), Duration.ofHours(1));

        cache.getOrCompute("rsi", series, parameters, counting("rsi"));
        cache.getOrCompute("rsi", revised, parameters, counting("rsi"));

        assertThat(calculations.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Size stays within the maximum as new entries arrive")
    void boundedSize() {
        PluginParameters none = PluginParameters.of(Map.of());
        for (String name : List.of("a", "b", "c", "d", "e")) {
            cache.getOrCompute(name, series, none, counting(name));
        }

        assertThat(calculations.get()).isEqualTo(5);
        assertThat(cache.getStats().size()).isBetween(1, 2);
        assertThat(cache.getStats().maxSize()).isEqualTo(2);
    }

    @Test
    @DisplayName("Failed calculations are not cached")
    void failureNotCached() {
        PluginParameters none = PluginParameters.of(Map.of());
        assertThatThrownBy(() -> cache.getOrCompute("x", series, none, () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(cache.getStats().size()).isZero();
    }

    @Test
    @DisplayName("Clear empties entries and statistics")
    void clear() {
        cache.getOrCompute("a", series, PluginParameters.of(Map.of()), counting("a"));

        cache.clear();

        assertThat(cache.getStats()).isEqualTo(new IndicatorCache.CacheStats(0, 0, 0, 2));
    }

    @Test
    @DisplayName("Non-positive size is rejected")
    void invalidSize() {
        assertThatThrownBy(() -> new IndicatorCache(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private Supplier<IndicatorSeries> counting(String name) {
        return () -> {
            calculations.incrementAndGet();
            return new IndicatorSeries(name, Map.of("value", List.of(BigDecimal.ONE)));
        };
    }
}
