package com.cryptotrader.observability;

import com.cryptotrader.domain.enums.RiskAction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Micrometer counters for the scheduler, the execution pipeline and the risk monitor.
 *
 * <ul>
 *   <li><b>strategy.runs</b> (counter, tag outcome=success|failure)</li>
 *   <li><b>market.data.retries</b> (counter): retried OHLCV fetches</li>
 *   <li><b>orders.submitted</b> / <b>orders.failed</b> / <b>orders.blocked</b> (counters);
 *       blocked means refused by the pre-trade risk check</li>
 *   <li><b>risk.actions</b> (counter, tag action): actionable evaluations dispatched by the monitor</li>
 * </ul>
 */
@Component
public class TradingMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter runSuccessCounter;
    private final Counter runFailureCounter;
    private final Counter marketDataRetryCounter;
    private final Counter ordersSubmittedCounter;
    private final Counter ordersFailedCounter;
    private final Counter ordersBlockedCounter;

    public TradingMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.runSuccessCounter = Counter.builder("strategy.runs")
                .description("Strategy pipeline runs")
                .tag("outcome", "success")
                .register(meterRegistry);
        this.runFailureCounter = Counter.builder("strategy.runs")
                .description("Strategy pipeline runs")
                .tag("outcome", "failure")
                .register(meterRegistry);
        this.marketDataRetryCounter = Counter.builder("market.data.retries")
                .description("OHLCV fetch attempts that were retried")
                .register(meterRegistry);
        this.ordersSubmittedCounter = Counter.builder("orders.submitted")
                .description("Orders accepted by the trading service")
                .register(meterRegistry);
        this.ordersFailedCounter = Counter.builder("orders.failed")
                .description("Order submissions that raised an error")
                .register(meterRegistry);
        this.ordersBlockedCounter = Counter.builder("orders.blocked")
                .description("Orders refused by the pre-trade risk check")
                .register(meterRegistry);
    }

    public void recordRun(boolean success) {
        (success ? runSuccessCounter : runFailureCounter).increment();
    }

    public void recordMarketDataRetry() {
        marketDataRetryCounter.increment();
    }

    public void recordOrderSubmitted() {
        ordersSubmittedCounter.increment();
    }

    public void recordOrderFailed() {
        ordersFailedCounter.increment();
    }

    public void recordOrderBlocked() {
        ordersBlockedCounter.increment();
    }

    public void recordRiskAction(RiskAction action) {
        meterRegistry.counter("risk.actions", "action", action.name()).increment();
    }
}
