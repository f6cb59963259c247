package com.cryptotrader.domain.model;

import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A configured strategy as stored by the strategy repository: which plugin to run
 * and the parameters it runs with.
 *
 * <p>Well-known parameter keys read by the scheduler: {@code exchange}, {@code symbol},
 * {@code timeframe} and {@code indicators} (indicator name to indicator parameters).
 * Everything else is passed through to the plugin.
 */
@Getter
@Builder
@ToString
public class StrategyDefinition {

    private final String id;
    private final String name;
    private final String pluginName;

    @Builder.Default
    private final Map<String, Object> parameters = Map.of();

    @Builder.Default
    private final boolean active = true;

    public Optional<String> stringParameter(String key) {
        Object value = parameters.get(key);
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }
}
