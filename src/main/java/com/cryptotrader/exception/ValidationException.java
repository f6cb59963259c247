package com.cryptotrader.exception;

import java.util.Map;

/**
 * Invalid input: bad configuration values, malformed strategy parameters or
 * market data that cannot be used. Never retried by the execution pipeline.
 */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorCode.VALIDATION_ERROR, message, cause);
    }
}
