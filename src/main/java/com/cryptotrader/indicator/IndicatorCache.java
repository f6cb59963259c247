package com.cryptotrader.indicator;

import com.cryptotrader.domain.vo.PluginParameters;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Instant;
import java.util.TreeMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ta4j.core.Bar;
import org.ta4j.core.BarSeries;

/**
 * Size-bounded Caffeine cache of calculated indicators.
 *
 * <p>Entries are keyed by indicator name, the series name ({@code exchange:symbol:timeframe}),
 * bar count, end time and close of the last bar, and the canonical parameter string. Two
 * markets with identical candles never share an entry; a new or revised candle is a miss.
 * A failing calculation is not cached.
 */
public class IndicatorCache {

    private static final Logger log = LoggerFactory.getLogger(IndicatorCache.class);

    private final int maxSize;
    private volatile Cache<CacheKey, IndicatorSeries> entries;

    public IndicatorCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Indicator cache size must be positive, got " + maxSize);
        }
        this.maxSize = maxSize;
        this.entries = newCache(maxSize);
    }

    public IndicatorSeries getOrCompute(
            String indicatorName,
            BarSeries series,
            PluginParameters parameters,
            Supplier<IndicatorSeries> calculation) {
        CacheKey key = CacheKey.of(indicatorName, series, parameters);
        return entries.get(key, k -> {
            IndicatorSeries computed = calculation.get();
            log.debug("Cached indicator {} for {}", indicatorName, series.getName());
            return computed;
        });
    }

    /** Drops every entry and starts the statistics afresh. */
    public void clear() {
        Cache<CacheKey, IndicatorSeries> previous = entries;
        entries = newCache(maxSize);
        previous.invalidateAll();
    }

    public CacheStats getStats() {
        Cache<CacheKey, IndicatorSeries> current = entries;
        current.cleanUp();
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = current.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), (int) current.estimatedSize(), maxSize);
    }

    // maintenance runs on the calling thread so size and stats are current when read
    private static Cache<CacheKey, IndicatorSeries> newCache(int maxSize) {
        return Caffeine.newBuilder()
                .maximumSize(maxSize)
                .executor(Runnable::run)
                .recordStats()
                .build();
    }

    private record CacheKey(
            String indicator, String market, int barCount, Instant lastBarEnd, String lastClose, String parameters) {

        static CacheKey of(String indicator, BarSeries series, PluginParameters parameters) {
            String canonical = new TreeMap<>(parameters.asMap()).toString();
            if (series.isEmpty()) {
                return new CacheKey(indicator, series.getName(), 0, null, null, canonical);
            }
            Bar last = series.getLastBar();
            return new CacheKey(
                    indicator,
                    series.getName(),
                    series.getBarCount(),
                    last.getEndTime().toInstant(),
                    last.getClosePrice().toString(),
                    canonical);
        }
    }

    public record CacheStats(long hits, long misses, int size, int maxSize) {

        public double hitRate() {
            long total = hits + misses;
            return total == 0 ? 0.0 : (double) hits / total;
        }
    }
}
