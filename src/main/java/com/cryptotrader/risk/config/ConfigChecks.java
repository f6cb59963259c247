package com.cryptotrader.risk.config;

import com.cryptotrader.exception.ValidationException;
import java.math.BigDecimal;

/** Range checks shared by the risk config records. All failures raise {@link ValidationException}. */
final class ConfigChecks {

    private ConfigChecks() {}

    /** Requires {@code 0 < value < upper}. */
    static void requireOpenRange(String field, BigDecimal value, int upper) {
        requireNonNull(field, value);
        if (value.signum() <= 0 || value.compareTo(BigDecimal.valueOf(upper)) >= 0) {
            throw new ValidationException(field + " must be greater than 0 and less than " + upper + ", got " + value);
        }
    }

    /** Requires {@code 0 < value <= upper}. */
    static void requireHalfOpenRange(String field, BigDecimal value, int upper) {
        requireNonNull(field, value);
        if (value.signum() <= 0 || value.compareTo(BigDecimal.valueOf(upper)) > 0) {
            throw new ValidationException(field + " must be greater than 0 and at most " + upper + ", got " + value);
        }
    }

    static void requirePositive(String field, BigDecimal value) {
        requireNonNull(field, value);
        if (value.signum() <= 0) {
            throw new ValidationException(field + " must be positive, got " + value);
        }
    }

    static void requirePositive(String field, long value) {
        if (value <= 0) {
            throw new ValidationException(field + " must be positive, got " + value);
        }
    }

    static void requireNonNegative(String field, long value) {
        if (value < 0) {
            throw new ValidationException(field + " must not be negative, got " + value);
        }
    }

    static void requireNonNull(String field, Object value) {
        if (value == null) {
            throw new ValidationException(field + " is required");
        }
    }
}
