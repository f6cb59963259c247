package com.cryptotrader.api.dto.response;

import java.time.Instant;

/** Success envelope the response advice puts around every {@code /api} body. */
public record ApiResponse<T>(boolean success, T data, Instant timestamp) {

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(true, data, Instant.now());
    }
}
