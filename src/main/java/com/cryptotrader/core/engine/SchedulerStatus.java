package com.cryptotrader.core.engine;

import java.time.Instant;
import java.util.List;

/** Snapshot of the strategy scheduler for the status endpoint. */
public record SchedulerStatus(
        boolean running,
        boolean dryRun,
        int maxConcurrentStrategies,
        int availableSlots,
        long completedCycles,
        Instant lastCycleAt,
        List<StrategyStatus> strategies) {

    public record StrategyStatus(
            String strategyKey,
            String timeframe,
            Instant lastExecution,
            Instant nextExecution,
            int consecutiveErrors,
            boolean circuitOpen) {}
}
