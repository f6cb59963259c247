package com.cryptotrader.exception;

/** Failure talking to an exchange. Treated as transient and retried where the caller retries. */
public class ExchangeException extends BaseException {

    public ExchangeException(String message) {
        super(ErrorCode.EXCHANGE_UNAVAILABLE, message);
    }

    public ExchangeException(String message, Throwable cause) {
        super(ErrorCode.EXCHANGE_UNAVAILABLE, message, cause);
    }
}
