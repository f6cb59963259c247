package com.cryptotrader.exchange;

import com.cryptotrader.domain.model.OhlcvCandle;
import java.util.List;

/**
 * Market-data access to one exchange. Implementations wrap their transport failures in
 * {@link com.cryptotrader.exception.ExchangeException}, which callers treat as transient.
 */
public interface ExchangeGateway {

    /** Exchange name as used in strategy parameters, e.g. "binance". */
    String name();

    /** Loads markets and credentials. Called once, before the first fetch. */
    void initialize();

    /**
     * Fetches the most recent candles, oldest first.
     *
     * @param timeframe candle timeframe code, e.g. "1h"
     * @param limit     maximum number of candles to return
     */
    List<OhlcvCandle> fetchOhlcv(String symbol, String timeframe, int limit);
}
