package com.cryptotrader.api.dto.response;

import com.cryptotrader.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;

/**
 * Error envelope. {@code error.retryable} tells a client whether the same request may
 * succeed later, e.g. when the exchange was unreachable.
 */
public record ApiErrorResponse(boolean success, ErrorDetail error) {

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(false, new ErrorDetail(
                errorCode.getCode(),
                errorCode.getHttpStatus(),
                errorCode.isRetryable(),
                message,
                details,
                path,
                Instant.now()));
    }

    public record ErrorDetail(
            String code,
            int status,
            boolean retryable,
            String message,
            Map<String, Object> details,
            String path,
            Instant timestamp) {}
}
