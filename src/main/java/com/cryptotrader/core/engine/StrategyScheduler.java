package com.cryptotrader.core.engine;

import com.cryptotrader.config.SchedulerProperties;
import com.cryptotrader.domain.enums.Timeframe;
import com.cryptotrader.domain.model.StrategyDefinition;
import com.cryptotrader.exchange.ExchangeGateway;
import com.cryptotrader.exchange.ExchangeRegistry;
import com.cryptotrader.repository.StrategyRepository;
import com.cryptotrader.strategy.StrategyPlugin;
import com.cryptotrader.strategy.StrategyPluginRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

/**
 * Decides when each active strategy runs and dispatches the runs.
 *
 * <p>Every cycle ({@link #runCycle()}):
 * <ol>
 *   <li>Loads the active strategies from the {@link StrategyRepository}</li>
 *   <li>Resolves plugin and exchange for each; strategies with an unknown plugin, a missing
 *       {@code exchange}/{@code symbol} parameter or a failing exchange are skipped with a log</li>
 *   <li>Selects the ready ones: never run, or at least one timeframe interval since the last
 *       clean run of their {@code id:symbol:timeframe} key</li>
 *   <li>Runs the ready batch on the worker pool, at most {@code maxConcurrentStrategies} at a
 *       time (the rest wait on the semaphore), and waits for the whole batch</li>
 *   <li>Stamps the cycle start as last execution and resets the error count of every clean run</li>
 *   <li>Returns the time until the next strategy is due, clamped to [minSleep, maxSleep];
 *       {@code idleSleep} when there is nothing to schedule</li>
 * </ol>
 *
 * <p>The loop thread survives any exception from a cycle (logged, then {@code errorPause});
 * only {@link #stop()} ends it. Stopping waits for the loop thread to exit and for in-flight
 * runs to finish; no batch is dispatched after that until the next {@link #start()}.
 */
@Service
public class StrategyScheduler {

    private static final Logger log = LoggerFactory.getLogger(StrategyScheduler.class);

    private static final String DEFAULT_TIMEFRAME = "1h";

    private final StrategyRepository strategyRepository;
    private final StrategyPluginRegistry strategyPluginRegistry;
    private final ExchangeRegistry exchangeRegistry;
    private final StrategyExecutionPipeline pipeline;
    private final StrategyErrorTracker errorTracker;
    private final SchedulerProperties schedulerProperties;
    private final Clock clock;

    private final Semaphore semaphore;
    private final Map<String, Instant> lastExecution = new ConcurrentHashMap<>();

    /** Keys seen in the latest cycle, with their timeframe. */
    private volatile Map<String, String> trackedKeys = Map.of();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong completedCycles = new AtomicLong();
    private volatile Instant lastCycleAt;

    private final Object lifecycleLock = new Object();
    private final Object workerLock = new Object();
    private ExecutorService loopExecutor;
    private ExecutorService workerExecutor;
    /** Guarded by {@code workerLock}. */
    private boolean workersClosed;
    private Future<?> loopFuture;

    public StrategyScheduler(
            StrategyRepository strategyRepository,
            StrategyPluginRegistry strategyPluginRegistry,
            ExchangeRegistry exchangeRegistry,
            StrategyExecutionPipeline pipeline,
            StrategyErrorTracker errorTracker,
            SchedulerProperties schedulerProperties,
            Clock clock) {
        this.strategyRepository = strategyRepository;
        this.strategyPluginRegistry = strategyPluginRegistry;
        this.exchangeRegistry = exchangeRegistry;
        this.pipeline = pipeline;
        this.errorTracker = errorTracker;
        this.schedulerProperties = schedulerProperties;
        this.clock = clock;
        this.semaphore = new Semaphore(schedulerProperties.getMaxConcurrentStrategies(), true);
    }

    // ========================
    // LIFECYCLE
    // ========================

    /**
     * Starts the scheduling loop on its own thread.
     *
     * @throws IllegalStateException if the scheduler is already running
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (!running.compareAndSet(false, true)) {
                throw new IllegalStateException("Strategy scheduler is already running");
            }
            synchronized (workerLock) {
                workersClosed = false;
            }
            loopExecutor = Executors.newSingleThreadExecutor(new CustomizableThreadFactory("strategy-scheduler-"));
            loopFuture = loopExecutor.submit(this::schedulerLoop);
        }
        log.info(
                "Strategy scheduler started (maxConcurrent={}, dryRun={})",
                schedulerProperties.getMaxConcurrentStrategies(),
                schedulerProperties.isDryRun());
    }

    /**
     * Cancels the loop, waits for its thread to exit and then blocks until dispatched runs
     * have drained (each wait up to {@code shutdownTimeout}).
     */
    public void stop() {
        long timeoutMillis = schedulerProperties.getShutdownTimeout().toMillis();
        synchronized (lifecycleLock) {
            if (!running.compareAndSet(true, false)) {
                log.warn("Strategy scheduler is not running");
                return;
            }
            synchronized (workerLock) {
                workersClosed = true;
            }
            if (loopFuture != null) {
                loopFuture.cancel(true);
            }
            if (loopExecutor != null) {
                loopExecutor.shutdownNow();
                try {
                    if (!loopExecutor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                        log.warn("Scheduler loop still running after {}ms", timeoutMillis);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while waiting for the scheduler loop to exit");
                }
            }
        }

        ExecutorService workers;
        synchronized (workerLock) {
            workers = workerExecutor;
            workerExecutor = null;
        }
        if (workers != null) {
            workers.shutdown();
            try {
                if (!workers.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                    log.warn("Strategy runs still in flight after {}ms, interrupting", timeoutMillis);
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workers.shutdownNow();
            }
        }
        log.info("Strategy scheduler stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    private void schedulerLoop() {
        while (running.get()) {
            Duration sleep;
            try {
                sleep = runCycle();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Scheduler loop interrupted during dispatch");
                return;
            } catch (Exception e) {
                log.error("Scheduler cycle failed: {}", e.getMessage(), e);
                sleep = schedulerProperties.getErrorPause();
            }

            try {
                Thread.sleep(sleep.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Scheduler loop interrupted while sleeping");
                return;
            }
        }
    }

    // ========================
    // CYCLE
    // ========================

    /**
     * Runs one scheduling cycle and returns how long to sleep before the next one.
     *
     * @throws InterruptedException if interrupted while waiting for the dispatched batch
     */
    public Duration runCycle() throws InterruptedException {
        Instant now = clock.instant();
        try {
            List<StrategyDefinition> active = strategyRepository.getActiveStrategies();
            if (active.isEmpty()) {
                log.debug("No active strategies");
                trackedKeys = Map.of();
                return schedulerProperties.getIdleSleep();
            }

            List<StrategyExecutionContext> contexts = createExecutionContexts(active);
            Map<String, String> keys = new ConcurrentHashMap<>();
            contexts.forEach(ctx -> keys.put(ctx.strategyKey(), ctx.getTimeframe()));
            trackedKeys = keys;
            if (contexts.isEmpty()) {
                return schedulerProperties.getIdleSleep();
            }

            List<StrategyExecutionContext> ready = new ArrayList<>();
            for (StrategyExecutionContext context : contexts) {
                if (isReady(context.strategyKey(), context.getTimeframe(), now)) {
                    ready.add(context);
                } else {
                    log.debug("Strategy {} not ready yet", context.strategyKey());
                }
            }
            if (!ready.isEmpty()) {
                dispatch(ready, now);
            }

            return nextSleep(contexts, now);
        } finally {
            lastCycleAt = now;
            completedCycles.incrementAndGet();
        }
    }

    List<StrategyExecutionContext> createExecutionContexts(List<StrategyDefinition> strategies) {
        List<StrategyExecutionContext> contexts = new ArrayList<>();
        for (StrategyDefinition definition : strategies) {
            try {
                createExecutionContext(definition).ifPresent(contexts::add);
            } catch (RuntimeException e) {
                log.error("Could not prepare strategy {}: {}", definition.getId(), e.getMessage(), e);
            }
        }
        return contexts;
    }

    private Optional<StrategyExecutionContext> createExecutionContext(StrategyDefinition definition) {
        Optional<Supplier<StrategyPlugin>> pluginFactory = strategyPluginRegistry.resolve(definition.getPluginName());
        if (pluginFactory.isEmpty()) {
            log.warn("Strategy plugin '{}' not found for strategy {}", definition.getPluginName(), definition.getId());
            return Optional.empty();
        }

        Optional<String> exchangeName = definition.stringParameter("exchange");
        Optional<String> symbol = definition.stringParameter("symbol");
        if (exchangeName.isEmpty() || symbol.isEmpty()) {
            log.warn("Strategy {} is missing exchange or symbol", definition.getId());
            return Optional.empty();
        }
        String timeframe = definition.stringParameter("timeframe").orElse(DEFAULT_TIMEFRAME);

        ExchangeGateway exchange;
        try {
            exchange = exchangeRegistry.getExchange(exchangeName.get());
        } catch (RuntimeException e) {
            log.error("Exchange '{}' unavailable for strategy {}: {}", exchangeName.get(), definition.getId(),
                    e.getMessage());
            return Optional.empty();
        }

        return Optional.of(StrategyExecutionContext.builder()
                .definition(definition)
                .pluginFactory(pluginFactory.get())
                .exchange(exchange)
                .exchangeName(exchangeName.get())
                .symbol(symbol.get())
                .timeframe(timeframe)
                .dryRun(schedulerProperties.isDryRun())
                .build());
    }

    boolean isReady(String strategyKey, String timeframe, Instant now) {
        Instant last = lastExecution.get(strategyKey);
        return last == null
                || Duration.between(last, now).compareTo(Timeframe.intervalOf(timeframe)) >= 0;
    }

    private void dispatch(List<StrategyExecutionContext> ready, Instant cycleStart) throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("Scheduler stopping, batch not dispatched");
        }
        ExecutorService workers = workers();
        if (workers == null) {
            throw new InterruptedException("Scheduler stopped, batch not dispatched");
        }
        List<Future<?>> futures = new ArrayList<>(ready.size());
        for (StrategyExecutionContext context : ready) {
            futures.add(workers.submit(() -> runWithPermit(context, cycleStart)));
        }
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                log.error("Strategy task failed: {}", e.getCause().getMessage(), e.getCause());
            }
        }
    }

    private void runWithPermit(StrategyExecutionContext context, Instant cycleStart) {
        try {
            semaphore.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted waiting for a run slot: {}", context.strategyKey());
            return;
        }
        try {
            pipeline.run(context);
        } finally {
            semaphore.release();
        }
        if (context.isSuccessful()) {
            lastExecution.put(context.strategyKey(), cycleStart);
            errorTracker.reset(context.strategyKey());
        }
    }

    private Duration nextSleep(List<StrategyExecutionContext> contexts, Instant now) {
        Duration untilNext = contexts.stream()
                .map(ctx -> untilDue(ctx.strategyKey(), ctx.getTimeframe(), now))
                .min(Comparator.naturalOrder())
                .orElse(schedulerProperties.getIdleSleep());
        Duration sleep = clamp(untilNext);
        log.debug("Scheduler sleeping {}s ({} strategies)", sleep.toSeconds(), contexts.size());
        return sleep;
    }

    private Duration untilDue(String strategyKey, String timeframe, Instant now) {
        Instant last = lastExecution.get(strategyKey);
        if (last == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(now, last.plus(Timeframe.intervalOf(timeframe)));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private Duration clamp(Duration duration) {
        if (duration.compareTo(schedulerProperties.getMinSleep()) < 0) {
            return schedulerProperties.getMinSleep();
        }
        if (duration.compareTo(schedulerProperties.getMaxSleep()) > 0) {
            return schedulerProperties.getMaxSleep();
        }
        return duration;
    }

    /** Returns the worker pool, or null once {@link #stop()} has closed it. */
    private ExecutorService workers() {
        synchronized (workerLock) {
            if (workersClosed) {
                return null;
            }
            if (workerExecutor == null || workerExecutor.isShutdown()) {
                workerExecutor = Executors.newCachedThreadPool(new CustomizableThreadFactory("strategy-run-"));
            }
            return workerExecutor;
        }
    }

    // ========================
    // STATUS
    // ========================

    public Optional<Instant> getLastExecution(String strategyKey) {
        return Optional.ofNullable(lastExecution.get(strategyKey));
    }

    public SchedulerStatus getStatus() {
        List<SchedulerStatus.StrategyStatus> strategies = new ArrayList<>();
        trackedKeys.forEach((key, timeframe) -> {
            Instant last = lastExecution.get(key);
            strategies.add(new SchedulerStatus.StrategyStatus(
                    key,
                    timeframe,
                    last,
                    last == null ? null : last.plus(Timeframe.intervalOf(timeframe)),
                    errorTracker.getErrorCount(key),
                    errorTracker.isCircuitOpen(key)));
        });
        strategies.sort(Comparator.comparing(SchedulerStatus.StrategyStatus::strategyKey));
        return new SchedulerStatus(
                running.get(),
                schedulerProperties.isDryRun(),
                schedulerProperties.getMaxConcurrentStrategies(),
                semaphore.availablePermits(),
                completedCycles.get(),
                lastCycleAt,
                strategies);
    }
}
