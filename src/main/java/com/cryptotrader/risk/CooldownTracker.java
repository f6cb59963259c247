package com.cryptotrader.risk;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-key cooldown stamps for risk actions. {@link #tryAcquire} checks and stamps in
 * one atomic step, so two concurrent evaluations of the same rule and symbol can
 * never both pass inside one cooldown window.
 */
public class CooldownTracker {

    private final Clock clock;
    private final Map<String, Instant> lastActionTimes = new ConcurrentHashMap<>();

    public CooldownTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * Returns true and records the current time if the key is outside its cooldown;
     * returns false and leaves the previous stamp untouched otherwise.
     */
    public boolean tryAcquire(String key, long cooldownSeconds) {
        Instant now = clock.instant();
        Duration cooldown = Duration.ofSeconds(cooldownSeconds);
        boolean[] acquired = {false};
        lastActionTimes.compute(key, (k, last) -> {
            if (last == null || Duration.between(last, now).compareTo(cooldown) >= 0) {
                acquired[0] = true;
                return now;
            }
            return last;
        });
        return acquired[0];
    }

    public void reset(String key) {
        lastActionTimes.remove(key);
    }
}
