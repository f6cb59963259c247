package com.cryptotrader.indicator;

import com.cryptotrader.domain.model.OhlcvCandle;
import com.cryptotrader.exception.ValidationException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;

/**
 * Builds ta4j {@link BarSeries} from exchange OHLCV rows.
 *
 * <p>Rows are ordered by open time and duplicated timestamps keep the last row seen,
 * since ta4j requires strictly increasing bar end times. Bars are stamped in UTC with
 * end time = open time + bar duration.
 */
public final class BarSeriesFactory {

    private BarSeriesFactory() {}

    public static BarSeries fromCandles(String name, List<OhlcvCandle> candles, Duration barDuration) {
        if (candles == null || candles.isEmpty()) {
            throw new ValidationException("No OHLCV data for " + name);
        }

        Map<Instant, OhlcvCandle> byOpenTime = new TreeMap<>();
        for (OhlcvCandle candle : candles) {
            if (candle.timestamp() == null || candle.close() == null) {
                throw new ValidationException("OHLCV row for " + name + " is missing timestamp or close");
            }
            byOpenTime.put(candle.timestamp(), candle);
        }

        BarSeries series = new BaseBarSeriesBuilder().withName(name).build();
        for (OhlcvCandle candle : byOpenTime.values()) {
            series.addBar(
                    barDuration,
                    candle.timestamp().plus(barDuration).atZone(ZoneOffset.UTC),
                    candle.open(),
                    candle.high(),
                    candle.low(),
                    candle.close(),
                    candle.volume());
        }
        return series;
    }
}
