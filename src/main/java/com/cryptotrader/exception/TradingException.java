package com.cryptotrader.exception;

/** The trading service refused or failed to place an order. */
public class TradingException extends BaseException {

    public TradingException(String message) {
        super(ErrorCode.ORDER_REJECTED, message);
    }

    public TradingException(String message, Throwable cause) {
        super(ErrorCode.ORDER_REJECTED, message, cause);
    }
}
