package com.cryptotrader.risk;

import com.cryptotrader.domain.enums.RiskAction;
import com.cryptotrader.domain.model.Position;
import com.cryptotrader.observability.TradingMetrics;
import com.cryptotrader.risk.config.RiskConfig;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Background loop that enforces position and drawdown risk continuously and fans
 * actionable evaluations out to registered callbacks.
 *
 * <p>Each tick:
 * <ol>
 *   <li>In emergency-only mode, evaluates drawdown and nothing else</li>
 *   <li>Otherwise refreshes positions from the {@link PositionProvider} (if any), marks
 *       each to the {@link PriceProvider} price (if any) and pushes it into the engine</li>
 *   <li>Runs the position rules for every tracked position, then the drawdown rule</li>
 *   <li>Records each actionable evaluation in a bounded history and runs all callbacks
 *       registered for its action concurrently</li>
 * </ol>
 *
 * <p>A failing position check is logged and the tick moves on to the next position and
 * the drawdown rule. Tick failures are logged and the loop carries on after the check
 * interval; callback failures are logged per callback. Only an {@link Error} stops the
 * loop on its own.
 *
 * <p>{@link #stop()} returns only once the loop thread has exited and every dispatched
 * callback has finished. Nothing is dispatched after that until the next {@link #start()}.
 * The interval is read from the engine's current config on every tick, so
 * {@link #updateCheckInterval(Duration)} takes effect from the next sleep.
 */
public class RiskMonitor {

    private static final Logger log = LoggerFactory.getLogger(RiskMonitor.class);

    public static final int HISTORY_LIMIT = 1000;
    private static final long STOP_TIMEOUT_SECONDS = 30;

    private final RiskEngine riskEngine;
    private final PositionProvider positionProvider;
    private final PriceProvider priceProvider;
    private final TradingMetrics tradingMetrics;

    private final Map<RiskAction, List<RiskActionCallback>> callbacks = new EnumMap<>(RiskAction.class);
    private final Deque<RiskEvaluationRecord> history = new ArrayDeque<>();
    private final AtomicLong totalEvaluations = new AtomicLong();
    private final Map<RiskAction, AtomicLong> actionCounts = new EnumMap<>(RiskAction.class);

    private final AtomicBoolean running = new AtomicBoolean(false);
    private ExecutorService loopExecutor;
    private ExecutorService callbackExecutor;
    private Future<?> loopFuture;
    /** Guarded by {@code this}; refuses new callback threads once set. */
    private boolean stopped;

    public RiskMonitor(
            RiskEngine riskEngine,
            PositionProvider positionProvider,
            PriceProvider priceProvider,
            TradingMetrics tradingMetrics) {
        this.riskEngine = riskEngine;
        this.positionProvider = positionProvider;
        this.priceProvider = priceProvider;
        this.tradingMetrics = tradingMetrics;
        for (RiskAction action : RiskAction.values()) {
            callbacks.put(action, new CopyOnWriteArrayList<>());
            actionCounts.put(action, new AtomicLong());
        }
    }

    // ========================
    // LIFECYCLE
    // ========================

    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Risk monitor is already running");
            return;
        }
        synchronized (this) {
            stopped = false;
        }
        loopExecutor = Executors.newSingleThreadExecutor(new CustomizableThreadFactory("risk-monitor-"));
        loopFuture = loopExecutor.submit(this::monitorLoop);
        log.info("Risk monitor started (check interval {})", riskEngine.getConfig().riskCheckInterval());
    }

    /**
     * Cancels the loop and waits for its thread to exit, then waits for callbacks that are
     * already running to finish. The tick in progress dispatches nothing further.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.warn("Risk monitor is not running");
            return;
        }
        synchronized (this) {
            stopped = true;
        }
        if (loopFuture != null) {
            loopFuture.cancel(true);
        }
        if (loopExecutor != null) {
            loopExecutor.shutdownNow();
            awaitTermination(loopExecutor, "Risk monitor loop");
        }
        ExecutorService callbacksToDrain;
        synchronized (this) {
            callbacksToDrain = callbackExecutor;
            callbackExecutor = null;
        }
        if (callbacksToDrain != null) {
            callbacksToDrain.shutdown();
            awaitTermination(callbacksToDrain, "Risk callbacks");
        }
        log.info("Risk monitor stopped");
    }

    private static void awaitTermination(ExecutorService executor, String name) {
        try {
            if (!executor.awaitTermination(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("{} still running after {}s", name, STOP_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for {} to finish", name);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private void monitorLoop() {
        try {
            while (running.get()) {
                try {
                    runChecks(running::get);
                } catch (Exception e) {
                    log.error("Error in risk monitor loop: {}", e.getMessage(), e);
                }
                Thread.sleep(riskEngine.getConfig().riskCheckInterval().toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Risk monitor loop interrupted");
        } catch (Error e) {
            running.set(false);
            log.error("Fatal error in risk monitor, monitoring stopped", e);
            throw e;
        }
    }

    // ========================
    // CHECKS
    // ========================

    /** Runs a single monitoring tick on the calling thread. */
    public void runChecks() {
        runChecks(() -> true);
    }

    /** One tick; {@code active} is polled between positions so a stopping loop ends early. */
    private void runChecks(BooleanSupplier active) {
        RiskConfig config = riskEngine.getConfig();
        if (config.emergencyOnlyMode()) {
            checkDrawdown();
            return;
        }

        if (positionProvider != null && !refreshPositions()) {
            return;
        }

        for (Position position : riskEngine.getPositions().values()) {
            if (!active.getAsBoolean()) {
                log.debug("Risk monitor stopping, remaining positions skipped");
                return;
            }
            try {
                for (RiskEvaluation evaluation : riskEngine.evaluatePositionRisk(position)) {
                    process(evaluation);
                }
            } catch (RuntimeException e) {
                log.error("Risk check failed for {}: {}", position.key(), e.getMessage(), e);
            }
        }
        if (active.getAsBoolean()) {
            checkDrawdown();
        }
    }

    private void checkDrawdown() {
        try {
            process(riskEngine.checkDrawdown());
        } catch (RuntimeException e) {
            log.error("Drawdown check failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Evaluates a proposed trade synchronously and records every actionable result.
     * Callbacks are not invoked; the caller decides what to do with the outcome.
     */
    public List<RiskEvaluation> checkNewTrade(String symbol, String exchange, BigDecimal proposedValue) {
        List<RiskEvaluation> evaluations = riskEngine.evaluateNewTradeRisk(symbol, exchange, proposedValue);
        evaluations.forEach(this::record);
        return evaluations;
    }

    private boolean refreshPositions() {
        List<Position> fetched;
        try {
            fetched = positionProvider.fetchPositions();
        } catch (Exception e) {
            log.error("Failed to refresh positions: {}", e.getMessage(), e);
            return false;
        }

        Set<String> seen = new HashSet<>();
        for (Position position : fetched) {
            Position marked = position;
            if (priceProvider != null) {
                try {
                    BigDecimal price = priceProvider.getPrice(position.getExchange(), position.getSymbol());
                    if (price != null) {
                        marked = position.withMarkPrice(price);
                    }
                } catch (Exception e) {
                    log.warn("Failed to refresh price for {}: {}", position.key(), e.getMessage());
                }
            }
            riskEngine.updatePosition(marked);
            seen.add(marked.key());
        }

        // positions the provider no longer reports are closed
        for (Position tracked : riskEngine.getPositions().values()) {
            if (!seen.contains(tracked.key())) {
                riskEngine.removePosition(tracked.getExchange(), tracked.getSymbol());
            }
        }
        return true;
    }

    private void process(RiskEvaluation evaluation) {
        if (!evaluation.isActionable()) {
            return;
        }
        record(evaluation);
        tradingMetrics.recordRiskAction(evaluation.getAction());
        dispatch(evaluation);
    }

    private void record(RiskEvaluation evaluation) {
        totalEvaluations.incrementAndGet();
        actionCounts.get(evaluation.getAction()).incrementAndGet();
        synchronized (history) {
            history.addLast(RiskEvaluationRecord.from(evaluation));
            while (history.size() > HISTORY_LIMIT) {
                history.removeFirst();
            }
        }
    }

    private void dispatch(RiskEvaluation evaluation) {
        List<RiskActionCallback> registered = callbacks.get(evaluation.getAction());
        if (registered.isEmpty()) {
            return;
        }
        ExecutorService executor = callbackExecutor();
        if (executor == null) {
            log.warn(
                    "Risk monitor stopped, {} callbacks not run for evaluation {}",
                    evaluation.getAction(),
                    evaluation.getEvaluationId());
            return;
        }
        CompletableFuture<?>[] futures = registered.stream()
                .map(callback -> CompletableFuture.runAsync(() -> invoke(callback, evaluation), executor))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(futures).join();
    }

    private void invoke(RiskActionCallback callback, RiskEvaluation evaluation) {
        try {
            callback.onRiskAction(evaluation);
        } catch (Exception e) {
            log.error(
                    "Risk callback failed for {} ({}): {}",
                    evaluation.getAction(),
                    evaluation.getEvaluationId(),
                    e.getMessage(),
                    e);
        }
    }

    /** Returns null once the monitor has been stopped and its pool drained. */
    private synchronized ExecutorService callbackExecutor() {
        if (callbackExecutor == null) {
            if (stopped) {
                return null;
            }
            callbackExecutor = Executors.newCachedThreadPool(new CustomizableThreadFactory("risk-callback-"));
        }
        return callbackExecutor;
    }

    // ========================
    // CALLBACKS, HISTORY, SETTINGS
    // ========================

    public void registerActionCallback(RiskAction action, RiskActionCallback callback) {
        callbacks.get(action).add(callback);
        log.debug("Registered risk callback for {}", action);
    }

    public boolean unregisterActionCallback(RiskAction action, RiskActionCallback callback) {
        return callbacks.get(action).remove(callback);
    }

    /** Returns recorded evaluations, most recent first. A null or non-positive limit returns all of them. */
    public List<RiskEvaluationRecord> getEvaluationHistory(Integer limit) {
        List<RiskEvaluationRecord> result = new ArrayList<>();
        synchronized (history) {
            Iterator<RiskEvaluationRecord> newestFirst = history.descendingIterator();
            while (newestFirst.hasNext() && (limit == null || limit <= 0 || result.size() < limit)) {
                result.add(newestFirst.next());
            }
        }
        return result;
    }

    public RiskMonitorStatistics getStatistics() {
        Map<RiskAction, Long> counts = new EnumMap<>(RiskAction.class);
        actionCounts.forEach((action, count) -> {
            if (count.get() > 0) {
                counts.put(action, count.get());
            }
        });
        return new RiskMonitorStatistics(
                totalEvaluations.get(),
                Collections.unmodifiableMap(counts),
                running.get(),
                riskEngine.getPositions().size());
    }

    /** Applies a new check interval by publishing a new config version. */
    public void updateCheckInterval(Duration interval) {
        RiskConfig current = riskEngine.getConfig();
        riskEngine.updateConfig(current.toBuilder().riskCheckInterval(interval).build());
        log.info("Risk check interval updated to {}", interval);
    }
}
