package com.cryptotrader.domain.enums;

/** Lifecycle of an exchange order. CLOSED means fully filled. */
public enum OrderStatus {
    PENDING,
    OPEN,
    CLOSED,
    CANCELED,
    EXPIRED,
    REJECTED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING && this != OPEN;
    }
}
