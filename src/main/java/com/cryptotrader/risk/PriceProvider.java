package com.cryptotrader.risk;

import java.math.BigDecimal;

/** Latest traded price for a symbol on an exchange. */
@FunctionalInterface
public interface PriceProvider {

    BigDecimal getPrice(String exchange, String symbol) throws Exception;
}
