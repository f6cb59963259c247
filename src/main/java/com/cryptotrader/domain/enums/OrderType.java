package com.cryptotrader.domain.enums;

public enum OrderType {
    MARKET,
    LIMIT
}
