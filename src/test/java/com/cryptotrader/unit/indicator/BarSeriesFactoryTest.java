package com.cryptotrader.unit.indicator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cryptotrader.domain.model.OhlcvCandle;
import com.cryptotrader.exception.ValidationException;
import com.cryptotrader.indicator.BarSeriesFactory;
import com.cryptotrader.unit.support.CandleFixtures;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.ta4j.core.BarSeries;

class BarSeriesFactoryTest {

    private static final Instant T0 = CandleFixtures.START;

    @Test
    @DisplayName("Rows are ordered by open time and end one bar duration later")
    void orderedAndStamped() {
        List<OhlcvCandle> rows = List.of(
                CandleFixtures.candle(T0.plusSeconds(7200), 102),
                CandleFixtures.candle(T0, 100),
                CandleFixtures.candle(T0.plusSeconds(3600), 101));

        BarSeries series = BarSeriesFactory.fromCandles("test", rows, Duration.ofHours(1));

        assertThat(series.getBarCount()).isEqualTo(3);
        assertThat(series.getBar(0).getClosePrice().doubleValue()).isEqualTo(100.0);
        assertThat(series.getLastBar().getClosePrice().doubleValue()).isEqualTo(102.0);
        assertThat(series.getBar(0).getEndTime().toInstant()).isEqualTo(T0.plusSeconds(3600));
        assertThat(series.getName()).isEqualTo("test");
    }

    @Test
    @DisplayName("Duplicate timestamps keep the last row")
    void duplicatesKeepLast() {
        List<OhlcvCandle> rows = List.of(
                CandleFixtures.candle(T0, 100),
                CandleFixtures.candle(T0.plusSeconds(60), 101),
                CandleFixtures.candle(T0.plusSeconds(60), 105));

        BarSeries series = BarSeriesFactory.fromCandles("test", rows, Duration.ofMinutes(1));

        assertThat(series.getBarCount()).isEqualTo(2);
        assertThat(series.getLastBar().getClosePrice().doubleValue()).isEqualTo(105.0);
    }

    @Test
    @DisplayName("Empty input and rows without a close are rejected")
    void invalidInput() {
        assertThatThrownBy(() -> BarSeriesFactory.fromCandles("test", List.of(), Duration.ofHours(1)))
                .isInstanceOf(ValidationException.class);

        List<OhlcvCandle> missingClose = List.of(new OhlcvCandle(T0, null, null, null, null, null));
        assertThatThrownBy(() -> BarSeriesFactory.fromCandles("test", missingClose, Duration.ofHours(1)))
                .isInstanceOf(ValidationException.class);
    }
}
