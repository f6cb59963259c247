package com.cryptotrader.exception;

import java.util.Map;

/** A named exchange, order, position or indicator does not exist. Never retried. */
public class ResourceNotFoundException extends BaseException {

    private ResourceNotFoundException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }

    public static ResourceNotFoundException exchange(String name) {
        return new ResourceNotFoundException(
                ErrorCode.EXCHANGE_NOT_FOUND, "No exchange registered as '" + name + "'", Map.of("exchange", name));
    }

    public static ResourceNotFoundException order(String exchange, String orderId) {
        return new ResourceNotFoundException(
                ErrorCode.ORDER_NOT_FOUND,
                "Order " + orderId + " not found on " + exchange,
                Map.of("exchange", exchange, "orderId", orderId));
    }

    public static ResourceNotFoundException position(String exchange, String symbol) {
        return new ResourceNotFoundException(
                ErrorCode.POSITION_NOT_FOUND,
                "No open position for " + symbol + " on " + exchange,
                Map.of("exchange", exchange, "symbol", symbol));
    }

    public static ResourceNotFoundException indicator(String name) {
        return new ResourceNotFoundException(
                ErrorCode.INDICATOR_NOT_FOUND, "Unknown indicator '" + name + "'", Map.of("indicator", name));
    }
}
