package com.cryptotrader.domain.enums;

/** Buy or sell side of an order or position. */
public enum OrderSide {
    BUY,
    SELL;

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. Used when closing a position. */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }
}
