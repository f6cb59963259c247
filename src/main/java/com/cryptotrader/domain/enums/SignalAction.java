package com.cryptotrader.domain.enums;

/** Direction proposed by a strategy plugin for the current bar. */
public enum SignalAction {
    BUY,
    SELL,
    HOLD;

    /** Maps a tradable signal to an order side; HOLD has no side. */
    public OrderSide toOrderSide() {
        return switch (this) {
            case BUY -> OrderSide.BUY;
            case SELL -> OrderSide.SELL;
            case HOLD -> throw new IllegalStateException("HOLD signal has no order side");
        };
    }

    public boolean isTradable() {
        return this != HOLD;
    }
}
