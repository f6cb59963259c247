package com.cryptotrader.indicator;

import com.cryptotrader.exception.ResourceNotFoundException;
import com.cryptotrader.indicator.impl.AtrIndicatorPlugin;
import com.cryptotrader.indicator.impl.BollingerBandsIndicatorPlugin;
import com.cryptotrader.indicator.impl.EmaIndicatorPlugin;
import com.cryptotrader.indicator.impl.MacdIndicatorPlugin;
import com.cryptotrader.indicator.impl.RsiIndicatorPlugin;
import com.cryptotrader.indicator.impl.SmaIndicatorPlugin;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Name-to-factory registry for indicator plugins. The built-in ta4j indicators are
 * registered on construction; additional plugins can be added with {@link #register}.
 */
@Component
public class IndicatorRegistry {

    private static final Logger log = LoggerFactory.getLogger(IndicatorRegistry.class);

    private final Map<String, Supplier<IndicatorPlugin>> factories = new ConcurrentHashMap<>();

    public IndicatorRegistry() {
        register(RsiIndicatorPlugin.NAME, RsiIndicatorPlugin::new);
        register(EmaIndicatorPlugin.NAME, EmaIndicatorPlugin::new);
        register(SmaIndicatorPlugin.NAME, SmaIndicatorPlugin::new);
        register(MacdIndicatorPlugin.NAME, MacdIndicatorPlugin::new);
        register(AtrIndicatorPlugin.NAME, AtrIndicatorPlugin::new);
        register(BollingerBandsIndicatorPlugin.NAME, BollingerBandsIndicatorPlugin::new);
    }

    public void register(String name, Supplier<IndicatorPlugin> factory) {
        if (factories.put(name.toLowerCase(), factory) != null) {
            log.warn("Indicator plugin '{}' re-registered", name);
        }
    }

    /**
     * Creates a fresh instance of the named indicator.
     *
     * @throws ResourceNotFoundException if no plugin is registered under the name
     */
    public IndicatorPlugin createIndicatorInstance(String name) {
        Supplier<IndicatorPlugin> factory = factories.get(name.toLowerCase());
        if (factory == null) {
            throw ResourceNotFoundException.indicator(name);
        }
        return factory.get();
    }

    public Set<String> getRegisteredNames() {
        return new TreeSet<>(factories.keySet());
    }
}
