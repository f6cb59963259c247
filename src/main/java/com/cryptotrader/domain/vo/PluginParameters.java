package com.cryptotrader.domain.vo;

import com.cryptotrader.exception.ValidationException;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Typed, read-only view over the loosely typed parameter maps that strategies and
 * indicators are configured with (values come from JSON, so numbers may arrive as
 * Integer, Double or String).
 *
 * <p>Every getter takes a default for absent keys and raises {@link ValidationException}
 * for values that are present but unusable.
 */
@ToString
@EqualsAndHashCode
public final class PluginParameters {

    private final Map<String, Object> values;

    private PluginParameters(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static PluginParameters of(Map<String, Object> values) {
        return new PluginParameters(values != null ? values : Map.of());
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean contains(String key) {
        return values.get(key) != null;
    }

    public int getInt(String key, int defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            if (number.doubleValue() != Math.rint(number.doubleValue())) {
                throw new ValidationException("Parameter '" + key + "' must be a whole number, got " + value);
            }
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Parameter '" + key + "' must be an integer, got '" + value + "'", e);
        }
    }

    public BigDecimal getDecimal(String key, BigDecimal defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Parameter '" + key + "' must be numeric, got '" + value + "'", e);
        }
    }

    public double getDouble(String key, double defaultValue) {
        BigDecimal value = getDecimal(key, null);
        return value == null ? defaultValue : value.doubleValue();
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        String text = value.toString().trim();
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return Boolean.parseBoolean(text);
        }
        throw new ValidationException("Parameter '" + key + "' must be true or false, got '" + value + "'");
    }

    public String getString(String key, String defaultValue) {
        Object value = values.get(key);
        return value == null ? defaultValue : value.toString();
    }

    /** Returns a nested parameter object, e.g. the {@code indicators} section of a strategy. */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new ValidationException(
                "Parameter '" + key + "' must be an object, got " + value.getClass().getSimpleName());
    }
}
