package com.cryptotrader.strategy;

import com.cryptotrader.strategy.impl.MacdCrossoverStrategy;
import com.cryptotrader.strategy.impl.RsiMeanReversionStrategy;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps a strategy's {@code pluginName} to a factory for its plugin.
 *
 * <p>Adding a strategy plugin:
 * <ol>
 *   <li>Implement {@link StrategyPlugin} under {@code strategy.impl}</li>
 *   <li>Register its constructor here under the name used in strategy definitions</li>
 * </ol>
 */
@Component
public class StrategyPluginRegistry {

    private static final Logger log = LoggerFactory.getLogger(StrategyPluginRegistry.class);

    private final Map<String, Supplier<StrategyPlugin>> factories = new ConcurrentHashMap<>();

    public StrategyPluginRegistry() {
        register(MacdCrossoverStrategy.NAME, MacdCrossoverStrategy::new);
        register(RsiMeanReversionStrategy.NAME, RsiMeanReversionStrategy::new);
    }

    public void register(String pluginName, Supplier<StrategyPlugin> factory) {
        if (factories.put(pluginName, factory) != null) {
            log.warn("Strategy plugin '{}' re-registered", pluginName);
        }
    }

    public Optional<Supplier<StrategyPlugin>> resolve(String pluginName) {
        return pluginName == null ? Optional.empty() : Optional.ofNullable(factories.get(pluginName));
    }

    public Set<String> getRegisteredNames() {
        return new TreeSet<>(factories.keySet());
    }
}
