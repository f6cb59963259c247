package com.cryptotrader.domain.model;

import java.math.BigDecimal;
import java.time.Instant;

/** One OHLCV row as returned by an exchange. {@code timestamp} is the candle open time. */
public record OhlcvCandle(
        Instant timestamp, BigDecimal open, BigDecimal high, BigDecimal low, BigDecimal close, BigDecimal volume) {}
