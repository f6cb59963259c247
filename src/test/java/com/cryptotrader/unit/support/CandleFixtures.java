package com.cryptotrader.unit.support;

import com.cryptotrader.domain.model.OhlcvCandle;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Synthetic OHLCV rows for unit tests. */
public final class CandleFixtures {

    public static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private CandleFixtures() {}

    /** Hourly candles whose close moves by {@code step} per bar from {@code startClose}. */
    public static List<OhlcvCandle> hourly(int count, double startClose, double step) {
        List<OhlcvCandle> candles = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            candles.add(candle(START.plus(Duration.ofHours(i)), startClose + i * step));
        }
        return candles;
    }

    /** Hourly candles with the given closes, in order. */
    public static List<OhlcvCandle> hourlyCloses(double... closes) {
        List<OhlcvCandle> candles = new ArrayList<>(closes.length);
        for (int i = 0; i < closes.length; i++) {
            candles.add(candle(START.plus(Duration.ofHours(i)), closes[i]));
        }
        return candles;
    }

    public static OhlcvCandle candle(Instant openTime, double close) {
        BigDecimal price = BigDecimal.valueOf(close);
        return new OhlcvCandle(
                openTime,
                price,
                price.add(BigDecimal.ONE),
                price.subtract(BigDecimal.ONE),
                price,
                BigDecimal.valueOf(10));
    }
}
