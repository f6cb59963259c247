package com.cryptotrader.core.engine;

import com.cryptotrader.config.RiskProperties;
import com.cryptotrader.config.SchedulerProperties;
import com.cryptotrader.risk.RiskMonitor;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Starts the risk monitor and then the strategy scheduler once the context is up, and
 * stops them in reverse order on shutdown so no strategy trades without risk monitoring.
 * Each is skipped when disabled ({@code cryptotrader.risk.monitor-enabled},
 * {@code cryptotrader.scheduler.enabled}).
 */
@Component
public class TradingBotLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TradingBotLifecycle.class);

    private final StrategyScheduler strategyScheduler;
    private final RiskMonitor riskMonitor;
    private final SchedulerProperties schedulerProperties;
    private final RiskProperties riskProperties;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public TradingBotLifecycle(
            StrategyScheduler strategyScheduler,
            RiskMonitor riskMonitor,
            SchedulerProperties schedulerProperties,
            RiskProperties riskProperties) {
        this.strategyScheduler = strategyScheduler;
        this.riskMonitor = riskMonitor;
        this.schedulerProperties = schedulerProperties;
        this.riskProperties = riskProperties;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        if (riskProperties.isMonitorEnabled()) {
            riskMonitor.start();
        } else {
            log.warn("Risk monitor disabled: open positions are not watched");
        }
        if (schedulerProperties.isEnabled()) {
            strategyScheduler.start();
        } else {
            log.info("Strategy scheduler disabled");
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Shutting down trading bot");
        if (strategyScheduler.isRunning()) {
            strategyScheduler.stop();
        }
        if (riskMonitor.isRunning()) {
            riskMonitor.stop();
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // Late start, early stop: everything the runs depend on is up first and down last
        return Integer.MAX_VALUE - 1000;
    }
}
