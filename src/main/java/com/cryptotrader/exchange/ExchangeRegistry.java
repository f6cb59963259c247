package com.cryptotrader.exchange;

import com.cryptotrader.exception.ExchangeException;
import com.cryptotrader.exception.ResourceNotFoundException;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Resolves exchange gateways by name and initializes each one on first use.
 * Gateways are discovered as Spring beans; none are required.
 */
@Component
public class ExchangeRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExchangeRegistry.class);

    private final Map<String, ExchangeGateway> gateways = new ConcurrentHashMap<>();
    private final Set<String> initialized = ConcurrentHashMap.newKeySet();

    public ExchangeRegistry(ObjectProvider<ExchangeGateway> exchangeGateways) {
        exchangeGateways.orderedStream().forEach(this::register);
    }

    public void register(ExchangeGateway gateway) {
        gateways.put(gateway.name().toLowerCase(), gateway);
        log.info("Registered exchange gateway '{}'", gateway.name());
    }

    /**
     * Returns the initialized gateway for the exchange.
     *
     * @throws ResourceNotFoundException if no gateway is registered under the name
     * @throws ExchangeException if the gateway fails to initialize; the next call retries
     */
    public ExchangeGateway getExchange(String name) {
        String key = name.toLowerCase();
        ExchangeGateway gateway = gateways.get(key);
        if (gateway == null) {
            throw ResourceNotFoundException.exchange(name);
        }
        if (!initialized.contains(key)) {
            synchronized (gateway) {
                if (!initialized.contains(key)) {
                    try {
                        gateway.initialize();
                    } catch (RuntimeException e) {
                        throw new ExchangeException("Failed to initialize exchange " + name, e);
                    }
                    initialized.add(key);
                    log.info("Exchange '{}' initialized", name);
                }
            }
        }
        return gateway;
    }

    public Set<String> getRegisteredNames() {
        return new TreeSet<>(gateways.keySet());
    }
}
