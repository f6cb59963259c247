package com.cryptotrader.risk;

import com.cryptotrader.domain.enums.OrderSide;
import com.cryptotrader.domain.enums.RiskAction;
import com.cryptotrader.domain.model.Position;
import com.cryptotrader.exception.ValidationException;
import com.cryptotrader.risk.config.RiskConfig;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Stateful risk evaluator: owns the position registry, the equity peak, the trading
 * pause flag and the cooldown stamps, and applies the rules in
 * {@link PositionRiskRules} and {@link PortfolioRiskRules} against them.
 *
 * <p>Responsible for:
 * <ul>
 *   <li><b>Position checks:</b> stop loss, take profit and trailing stop, each gated by a
 *       per-symbol cooldown so one breach produces one action</li>
 *   <li><b>Admission checks:</b> exposure, concurrent trade and drawdown limits for a
 *       proposed trade; short-circuited while trading is paused</li>
 *   <li><b>Equity tracking:</b> current equity and the peak over the last
 *       {@code calculation_period_days}, for drawdown</li>
 * </ul>
 *
 * <p>The registry is guarded by a read/write lock and only copies cross its boundary.
 * The configuration is an immutable {@link RiskConfig} swapped atomically; every swap
 * bumps {@link #getConfigVersion()}.
 */
@Service
public class RiskEngine {

    private static final Logger log = LoggerFactory.getLogger(RiskEngine.class);

    private static final List<String> EXIT_RULES = List.of("stop_loss", "take_profit", "trailing_stop");

    private final Clock clock;
    private final CooldownTracker cooldowns;
    private final AtomicReference<RiskConfig> config;
    private final AtomicLong configVersion = new AtomicLong(1);

    private final Map<String, Position> positions = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final AtomicReference<EquitySnapshot> equity =
            new AtomicReference<>(new EquitySnapshot(BigDecimal.ZERO, BigDecimal.ZERO));
    /** Equity samples in time order with strictly decreasing values; the head is the window peak. */
    private final Deque<EquitySample> equityWindow = new ArrayDeque<>();
    private final AtomicBoolean tradingPaused = new AtomicBoolean(false);

    public RiskEngine(RiskConfig riskConfig, Clock clock) {
        this.config = new AtomicReference<>(riskConfig);
        this.clock = clock;
        this.cooldowns = new CooldownTracker(clock);
    }

    // ========================
    // CONFIGURATION
    // ========================

    public RiskConfig getConfig() {
        return config.get();
    }

    public long getConfigVersion() {
        return configVersion.get();
    }

    /** Replaces the active configuration. Evaluations already in progress keep the snapshot they started with. */
    public void updateConfig(RiskConfig newConfig) {
        if (newConfig == null) {
            throw new ValidationException("Risk config must not be null");
        }
        config.set(newConfig);
        long version = configVersion.incrementAndGet();
        log.info("Risk config updated to version {}", version);
    }

    // ========================
    // POSITION REGISTRY
    // ========================

    /**
     * Inserts or replaces a position. The stored best price only moves in the
     * position's favour: up for BUY, down for SELL. A side flip starts tracking afresh.
     */
    public void updatePosition(Position position) {
        if (position == null || position.getSymbol() == null || position.getExchange() == null) {
            throw new ValidationException("Position requires symbol and exchange");
        }
        Position stored = position.copy();
        lock.writeLock().lock();
        try {
            Position existing = positions.get(stored.key());
            BigDecimal best = stored.getHighestPrice();
            if (existing != null && existing.getSide() == stored.getSide()) {
                best = better(stored.getSide(), best, existing.getHighestPrice());
            }
            best = better(stored.getSide(), best, stored.getCurrentPrice());
            stored.setHighestPrice(best);
            positions.put(stored.key(), stored);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Removes a position and clears its exit cooldowns, so a re-opened position is checked afresh. */
    public boolean removePosition(String exchange, String symbol) {
        boolean removed;
        lock.writeLock().lock();
        try {
            removed = positions.remove(Position.keyOf(exchange, symbol)) != null;
        } finally {
            lock.writeLock().unlock();
        }
        if (removed) {
            for (String rule : EXIT_RULES) {
                cooldowns.reset(rule + "_" + symbol);
            }
        }
        return removed;
    }

    /** Returns a snapshot of the registry; mutating the result or its positions has no effect on the engine. */
    public Map<String, Position> getPositions() {
        lock.readLock().lock();
        try {
            Map<String, Position> snapshot = new LinkedHashMap<>();
            positions.forEach((key, position) -> snapshot.put(key, position.copy()));
            return snapshot;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Position> getPosition(String exchange, String symbol) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(positions.get(Position.keyOf(exchange, symbol)))
                    .map(Position::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ========================
    // POSITION RULES
    // ========================

    public RiskEvaluation checkStopLoss(Position position) {
        RiskConfig current = config.get();
        RiskEvaluation evaluation = PositionRiskRules.stopLoss(position, current.stopLoss(), clock.instant());
        return applyCooldown(
                evaluation, PositionRiskRules.STOP_LOSS, position, current.stopLoss().cooldownSeconds());
    }

    public RiskEvaluation checkTakeProfit(Position position) {
        RiskConfig current = config.get();
        RiskEvaluation evaluation = PositionRiskRules.takeProfit(position, current.takeProfit(), clock.instant());
        return applyCooldown(
                evaluation, PositionRiskRules.TAKE_PROFIT, position, current.takeProfit().cooldownSeconds());
    }

    public RiskEvaluation checkTrailingStop(Position position) {
        RiskConfig current = config.get();
        RiskEvaluation evaluation =
                PositionRiskRules.trailingStop(position, current.trailingStop(), clock.instant());
        return applyCooldown(
                evaluation, PositionRiskRules.TRAILING_STOP, position, current.trailingStop().cooldownSeconds());
    }

    /** Runs every position rule and returns the actionable results in rule order. */
    public List<RiskEvaluation> evaluatePositionRisk(Position position) {
        List<RiskEvaluation> evaluations = new ArrayList<>();
        addIfActionable(evaluations, checkStopLoss(position));
        addIfActionable(evaluations, checkTakeProfit(position));
        addIfActionable(evaluations, checkTrailingStop(position));
        return evaluations;
    }

    // ========================
    // PORTFOLIO RULES
    // ========================

    public RiskEvaluation checkExposureLimits(String symbol, String exchange, BigDecimal proposedValue) {
        RiskEvaluation evaluation = PortfolioRiskRules.exposure(
                positionSnapshot(), symbol, exchange, proposedValue, config.get().exposureLimits(), clock.instant());
        if (evaluation.isActionable()) {
            log.warn("Exposure limit would be exceeded for {} on {}: {}", symbol, exchange, evaluation.getReason());
        }
        return evaluation;
    }

    public RiskEvaluation checkMaxConcurrentTrades(String symbol, String exchange) {
        RiskEvaluation evaluation = PortfolioRiskRules.concurrentTrades(
                positionSnapshot(), symbol, exchange, config.get().maxConcurrentTrades(), clock.instant());
        if (evaluation.isActionable()) {
            log.warn(
                    "Max concurrent trades would be exceeded for {} on {}: {}",
                    symbol,
                    exchange,
                    evaluation.getReason());
        }
        return evaluation;
    }

    /** Evaluates drawdown from peak equity. A PAUSE_TRADING result also sets the paused flag. */
    public RiskEvaluation checkDrawdown() {
        EquitySnapshot snapshot = slideEquityWindow(null);
        RiskEvaluation evaluation = PortfolioRiskRules.drawdown(
                snapshot.peak(), snapshot.current(), config.get().drawdownControl(), clock.instant());

        if (evaluation.getAction() == RiskAction.EMERGENCY_EXIT_ALL) {
            log.error("EMERGENCY DRAWDOWN THRESHOLD BREACHED: {}", evaluation.getReason());
        } else if (evaluation.getAction() == RiskAction.PAUSE_TRADING) {
            if (tradingPaused.compareAndSet(false, true)) {
                log.error("{}. Trading paused.", evaluation.getReason());
            }
        }
        return evaluation;
    }

    /**
     * Admission check for a proposed trade. Returns the actionable evaluations; an
     * empty list means the trade may proceed.
     */
    public List<RiskEvaluation> evaluateNewTradeRisk(String symbol, String exchange, BigDecimal proposedValue) {
        if (tradingPaused.get()) {
            return List.of(RiskEvaluation.of(
                    RiskAction.BLOCK_NEW_TRADE,
                    "Trading is paused due to risk limits",
                    List.of("trading_paused"),
                    null,
                    Map.of(),
                    clock.instant()));
        }

        List<RiskEvaluation> evaluations = new ArrayList<>();
        addIfActionable(evaluations, checkExposureLimits(symbol, exchange, proposedValue));
        addIfActionable(evaluations, checkMaxConcurrentTrades(symbol, exchange));
        addIfActionable(evaluations, checkDrawdown());
        return evaluations;
    }

    // ========================
    // EQUITY AND TRADING STATE
    // ========================

    public void updateEquity(BigDecimal currentEquity) {
        if (currentEquity == null) {
            throw new ValidationException("Equity must not be null");
        }
        slideEquityWindow(currentEquity);
    }

    /**
     * Drops samples older than the calculation period, appends {@code sample} when given
     * and republishes the snapshot with the window peak.
     */
    private EquitySnapshot slideEquityWindow(BigDecimal sample) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofDays(config.get().drawdownControl().calculationPeriodDays()));
        synchronized (equityWindow) {
            while (!equityWindow.isEmpty() && equityWindow.peekFirst().at().isBefore(cutoff)) {
                equityWindow.removeFirst();
            }
            BigDecimal current = equity.get().current();
            if (sample != null) {
                while (!equityWindow.isEmpty() && equityWindow.peekLast().equity().compareTo(sample) <= 0) {
                    equityWindow.removeLast();
                }
                equityWindow.addLast(new EquitySample(now, sample));
                current = sample;
            }
            BigDecimal peak = equityWindow.isEmpty() ? current : equityWindow.peekFirst().equity();
            EquitySnapshot snapshot = new EquitySnapshot(peak, current);
            equity.set(snapshot);
            return snapshot;
        }
    }

    public BigDecimal getPeakEquity() {
        return equity.get().peak();
    }

    public BigDecimal getCurrentEquity() {
        return equity.get().current();
    }

    public boolean isTradingPaused() {
        return tradingPaused.get();
    }

    /** Clears the paused flag. Calling it while trading is not paused is a no-op. */
    public void resumeTrading() {
        if (tradingPaused.compareAndSet(true, false)) {
            log.info("Trading resumed");
        }
    }

    private RiskEvaluation applyCooldown(
            RiskEvaluation evaluation, String rule, Position position, long cooldownSeconds) {
        if (!evaluation.isActionable()) {
            return evaluation;
        }
        String cooldownKey = rule + "_" + position.getSymbol();
        if (!cooldowns.tryAcquire(cooldownKey, cooldownSeconds)) {
            log.debug("{} for {} suppressed by cooldown", rule, position.key());
            return RiskEvaluation.none(rule + " in cooldown", evaluation.getEvaluatedAt());
        }
        log.warn("{} for {}: {}", rule, position.key(), evaluation.getReason());
        return evaluation;
    }

    private Collection<Position> positionSnapshot() {
        return getPositions().values();
    }

    private static void addIfActionable(List<RiskEvaluation> evaluations, RiskEvaluation evaluation) {
        if (evaluation.isActionable()) {
            evaluations.add(evaluation);
        }
    }

    private static BigDecimal better(OrderSide side, BigDecimal a, BigDecimal b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return side == OrderSide.SELL ? a.min(b) : a.max(b);
    }

    private record EquitySnapshot(BigDecimal peak, BigDecimal current) {}

    private record EquitySample(Instant at, BigDecimal equity) {}
}
