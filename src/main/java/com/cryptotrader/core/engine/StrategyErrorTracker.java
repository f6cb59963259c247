package com.cryptotrader.core.engine;

import com.cryptotrader.config.SchedulerProperties;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Consecutive-failure counters per strategy key.
 *
 * <p>Reaching {@code maxConsecutiveErrors} only reports the key as circuit-broken
 * (log + status endpoint); the scheduler keeps dispatching it, and the next clean
 * run closes the circuit again.
 */
@Component
public class StrategyErrorTracker {

    private static final Logger log = LoggerFactory.getLogger(StrategyErrorTracker.class);

    private final Map<String, AtomicInteger> errorCounts = new ConcurrentHashMap<>();
    private final SchedulerProperties schedulerProperties;

    public StrategyErrorTracker(SchedulerProperties schedulerProperties) {
        this.schedulerProperties = schedulerProperties;
    }

    public int increment(String strategyKey) {
        int count = errorCounts.computeIfAbsent(strategyKey, k -> new AtomicInteger()).incrementAndGet();
        if (count >= schedulerProperties.getMaxConsecutiveErrors()) {
            log.warn(
                    "Circuit breaker open for {}: {} consecutive errors (max {})",
                    strategyKey,
                    count,
                    schedulerProperties.getMaxConsecutiveErrors());
        }
        return count;
    }

    public void reset(String strategyKey) {
        AtomicInteger count = errorCounts.get(strategyKey);
        if (count != null && count.getAndSet(0) > 0) {
            log.info("Error count reset for {}", strategyKey);
        }
    }

    public int getErrorCount(String strategyKey) {
        AtomicInteger count = errorCounts.get(strategyKey);
        return count == null ? 0 : count.get();
    }

    public boolean isCircuitOpen(String strategyKey) {
        return getErrorCount(strategyKey) >= schedulerProperties.getMaxConsecutiveErrors();
    }

    public Map<String, Integer> snapshot() {
        Map<String, Integer> copy = new TreeMap<>();
        errorCounts.forEach((key, count) -> copy.put(key, count.get()));
        return copy;
    }
}
