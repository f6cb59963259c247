package com.cryptotrader.exchange;

import com.cryptotrader.domain.model.Position;
import com.cryptotrader.risk.PriceProvider;
import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Last close seen per exchange and symbol, recorded by the execution pipeline after each
 * market data fetch. Serves as the mark price for the risk monitor and paper fills.
 */
@Component
public class LatestPriceBook implements PriceProvider {

    private static final Logger log = LoggerFactory.getLogger(LatestPriceBook.class);

    private final Map<String, BigDecimal> prices = new ConcurrentHashMap<>();

    public void record(String exchange, String symbol, BigDecimal price) {
        if (price == null || price.signum() <= 0) {
            log.debug("Ignoring non-positive price {} for {}:{}", price, exchange, symbol);
            return;
        }
        prices.put(Position.keyOf(exchange, symbol), price);
    }

    /** Returns the last recorded price, or null when the symbol has not been fetched yet. */
    @Override
    public BigDecimal getPrice(String exchange, String symbol) {
        return prices.get(Position.keyOf(exchange, symbol));
    }

    public int size() {
        return prices.size();
    }
}
