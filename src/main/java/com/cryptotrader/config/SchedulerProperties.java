package com.cryptotrader.config;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Strategy scheduler and execution pipeline settings, bound from application.yml
 * under {@code cryptotrader.scheduler}.
 */
@Data
@ConfigurationProperties(prefix = "cryptotrader.scheduler")
public class SchedulerProperties {

    /** Whether the scheduler loop starts with the application. */
    private boolean enabled = true;

    /** Runs the full pipeline but only logs the orders it would place. */
    private boolean dryRun = false;

    private int maxConcurrentStrategies = 10;

    /** Consecutive failures after which a strategy key is reported as circuit-broken. */
    private int maxConsecutiveErrors = 5;

    /** Extra attempts for a failed OHLCV fetch, on top of the first one. */
    private int marketDataRetries = 3;

    /** First backoff delay; doubles per retry up to {@link #retryMaxDelay}. */
    private Duration retryInitialDelay = Duration.ofSeconds(2);

    private Duration retryMaxDelay = Duration.ofSeconds(30);

    /** Candles requested per fetch. */
    private int candleLimit = 100;

    /** Pause after an unexpected scheduler loop error. */
    private Duration errorPause = Duration.ofSeconds(10);

    /** Sleep when no strategy is active. */
    private Duration idleSleep = Duration.ofSeconds(60);

    private Duration minSleep = Duration.ofSeconds(1);
    private Duration maxSleep = Duration.ofSeconds(60);

    /** Runs the risk engine's new-trade admission check before every order. */
    private boolean preTradeRiskCheck = true;

    /** Order quantity when a signal does not carry one. */
    private BigDecimal defaultOrderQuantity = new BigDecimal("0.001");

    private Duration orderTimeout = Duration.ofSeconds(30);

    /** How long stop waits for in-flight strategy runs. */
    private Duration shutdownTimeout = Duration.ofSeconds(30);
}
