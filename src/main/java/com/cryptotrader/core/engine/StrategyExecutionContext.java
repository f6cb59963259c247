package com.cryptotrader.core.engine;

import com.cryptotrader.domain.model.OhlcvCandle;
import com.cryptotrader.domain.model.Order;
import com.cryptotrader.domain.model.StrategyDefinition;
import com.cryptotrader.domain.model.StrategySignal;
import com.cryptotrader.domain.vo.PluginParameters;
import com.cryptotrader.exchange.ExchangeGateway;
import com.cryptotrader.indicator.IndicatorSeries;
import com.cryptotrader.strategy.StrategyPlugin;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import org.ta4j.core.BarSeries;

/**
 * State of one strategy run, created by the scheduler for a single dispatch and
 * filled in step by step by {@link StrategyExecutionPipeline}. Never reused across runs.
 *
 * <p>{@code error} is set when a step before trade execution failed; a failed order
 * submission only sets {@code tradeError}, which does not count against the run.
 */
@Getter
public class StrategyExecutionContext {

    private final StrategyDefinition definition;
    private final Supplier<StrategyPlugin> pluginFactory;
    private final ExchangeGateway exchange;
    private final String exchangeName;
    private final String symbol;
    private final String timeframe;
    private final boolean dryRun;
    private final PluginParameters parameters;

    @Setter
    private StrategyPlugin strategyInstance;

    @Setter
    private List<OhlcvCandle> candles;

    @Setter
    private BarSeries series;

    private final Map<String, IndicatorSeries> indicators = new LinkedHashMap<>();

    @Setter
    private StrategySignal signal;

    @Setter
    private Order order;

    @Setter
    private Exception error;

    @Setter
    private Exception tradeError;

    @Builder
    private StrategyExecutionContext(
            StrategyDefinition definition,
            Supplier<StrategyPlugin> pluginFactory,
            ExchangeGateway exchange,
            String exchangeName,
            String symbol,
            String timeframe,
            boolean dryRun) {
        this.definition = definition;
        this.pluginFactory = pluginFactory;
        this.exchange = exchange;
        this.exchangeName = exchangeName;
        this.symbol = symbol;
        this.timeframe = timeframe;
        this.dryRun = dryRun;
        this.parameters = PluginParameters.of(definition.getParameters());
    }

    /** Scheduling and circuit-breaker key: {@code id:symbol:timeframe}. */
    public String strategyKey() {
        return keyOf(definition.getId(), symbol, timeframe);
    }

    public static String keyOf(String strategyId, String symbol, String timeframe) {
        return strategyId + ":" + symbol + ":" + timeframe;
    }

    public boolean isSuccessful() {
        return error == null;
    }
}
