package com.cryptotrader.exception;

/**
 * Error codes returned in the {@code error.code} field of REST error bodies.
 *
 * <p>{@code retryable} marks failures a caller may simply try again: the market data
 * fetcher retries those and nothing else.
 */
public enum ErrorCode {
    VALIDATION_ERROR(400, false),
    MALFORMED_REQUEST(400, false),
    EXCHANGE_NOT_FOUND(404, false),
    ORDER_NOT_FOUND(404, false),
    POSITION_NOT_FOUND(404, false),
    INDICATOR_NOT_FOUND(404, false),
    INVALID_STATE(409, false),
    ORDER_REJECTED(422, false),
    EXCHANGE_UNAVAILABLE(502, true),
    INTERNAL_ERROR(500, false);

    private final int httpStatus;
    private final boolean retryable;

    ErrorCode(int httpStatus, boolean retryable) {
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }

    public String getCode() {
        return name();
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
