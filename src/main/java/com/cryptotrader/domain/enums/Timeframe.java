package com.cryptotrader.domain.enums;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Candle timeframes understood by the scheduler, keyed by the exchange-style code
 * used in strategy parameters ("1m", "1h", ...).
 */
@Getter
@RequiredArgsConstructor
public enum Timeframe {
    ONE_MINUTE("1m", 60),
    THREE_MINUTES("3m", 180),
    FIVE_MINUTES("5m", 300),
    FIFTEEN_MINUTES("15m", 900),
    THIRTY_MINUTES("30m", 1800),
    ONE_HOUR("1h", 3600),
    TWO_HOURS("2h", 7200),
    FOUR_HOURS("4h", 14400),
    SIX_HOURS("6h", 21600),
    TWELVE_HOURS("12h", 43200),
    ONE_DAY("1d", 86400);

    /** Interval used for timeframe codes that are not listed above. */
    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(60);

    private final String code;
    private final long seconds;

    public Duration toDuration() {
        return Duration.ofSeconds(seconds);
    }

    public static Optional<Timeframe> fromCode(String code) {
        return Arrays.stream(values()).filter(tf -> tf.code.equals(code)).findFirst();
    }

    /** Execution interval for a timeframe code, falling back to 60 seconds for unknown codes. */
    public static Duration intervalOf(String code) {
        return fromCode(code).map(Timeframe::toDuration).orElse(DEFAULT_INTERVAL);
    }
}
