package com.cryptotrader.core.engine;

import com.cryptotrader.config.SchedulerProperties;
import com.cryptotrader.domain.enums.OrderSide;
import com.cryptotrader.domain.enums.OrderType;
import com.cryptotrader.domain.enums.Timeframe;
import com.cryptotrader.domain.model.OhlcvCandle;
import com.cryptotrader.domain.model.Order;
import com.cryptotrader.domain.model.StrategySignal;
import com.cryptotrader.domain.vo.PluginParameters;
import com.cryptotrader.domain.model.Position;
import com.cryptotrader.exception.ValidationException;
import com.cryptotrader.exchange.LatestPriceBook;
import com.cryptotrader.indicator.BarSeriesFactory;
import com.cryptotrader.indicator.IndicatorCache;
import com.cryptotrader.indicator.IndicatorPlugin;
import com.cryptotrader.indicator.IndicatorRegistry;
import com.cryptotrader.indicator.IndicatorSeries;
import com.cryptotrader.observability.TradingMetrics;
import com.cryptotrader.oms.OrderRequest;
import com.cryptotrader.oms.TradingService;
import com.cryptotrader.risk.RiskEngine;
import com.cryptotrader.risk.RiskEvaluation;
import com.cryptotrader.strategy.MarketData;
import com.cryptotrader.strategy.StrategyPlugin;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.ta4j.core.BarSeries;

/**
 * Runs one strategy through its four strictly sequential steps:
 * <ol>
 *   <li><b>Market data:</b> OHLCV via {@link MarketDataFetcher} (retried), converted to a
 *       ta4j {@link BarSeries}. A successful fetch resets the key's error count.</li>
 *   <li><b>Indicators:</b> every entry of the {@code indicators} parameter, through the
 *       {@link IndicatorCache}. A failing indicator is logged and left out.</li>
 *   <li><b>Signal:</b> the strategy plugin's {@code generateSignal}.</li>
 *   <li><b>Trade:</b> BUY/SELL signals only. Dry-run logs the order instead; otherwise the
 *       order passes the optional pre-trade risk check and goes to the {@link TradingService}.
 *       Orders against the side of an open position reduce it and skip that check.</li>
 * </ol>
 *
 * <p>Failures in steps 1-3 are captured on the context, counted by the
 * {@link StrategyErrorTracker} and never rethrown. Trade failures are counted too but
 * only set {@code tradeError}, so the run still counts as clean for scheduling.
 */
@Service
public class StrategyExecutionPipeline {

    private static final Logger log = LoggerFactory.getLogger(StrategyExecutionPipeline.class);

    private static final String INDICATORS_PARAMETER = "indicators";

    private final MarketDataFetcher marketDataFetcher;
    private final IndicatorRegistry indicatorRegistry;
    private final IndicatorCache indicatorCache;
    private final TradingService tradingService;
    private final RiskEngine riskEngine;
    private final StrategyErrorTracker errorTracker;
    private final SchedulerProperties schedulerProperties;
    private final TradingMetrics tradingMetrics;
    private final LatestPriceBook priceBook;

    public StrategyExecutionPipeline(
            MarketDataFetcher marketDataFetcher,
            IndicatorRegistry indicatorRegistry,
            IndicatorCache indicatorCache,
            TradingService tradingService,
            RiskEngine riskEngine,
            StrategyErrorTracker errorTracker,
            SchedulerProperties schedulerProperties,
            TradingMetrics tradingMetrics,
            LatestPriceBook priceBook) {
        this.marketDataFetcher = marketDataFetcher;
        this.indicatorRegistry = indicatorRegistry;
        this.indicatorCache = indicatorCache;
        this.tradingService = tradingService;
        this.riskEngine = riskEngine;
        this.errorTracker = errorTracker;
        this.schedulerProperties = schedulerProperties;
        this.tradingMetrics = tradingMetrics;
        this.priceBook = priceBook;
    }

    public void run(StrategyExecutionContext context) {
        String strategyKey = context.strategyKey();
        log.info(
                "Strategy run start: {} ({}) {} {} dryRun={}",
                context.getDefinition().getName(),
                context.getDefinition().getId(),
                context.getSymbol(),
                context.getTimeframe(),
                context.isDryRun());

        try {
            if (context.getStrategyInstance() == null) {
                StrategyPlugin plugin = context.getPluginFactory().get();
                plugin.validateParameters(context.getParameters());
                context.setStrategyInstance(plugin);
            }

            fetchMarketData(context);
            computeIndicators(context);
            generateSignal(context);

            StrategySignal signal = context.getSignal();
            if (signal != null && signal.getAction().isTradable()) {
                executeTrade(context);
            }

            tradingMetrics.recordRun(true);
            log.info(
                    "Strategy run complete: {} signal={} orderCreated={}",
                    strategyKey,
                    signal != null ? signal.getAction() : null,
                    context.getOrder() != null);
        } catch (Exception e) {
            context.setError(e);
            int errorCount = errorTracker.increment(strategyKey);
            tradingMetrics.recordRun(false);
            log.error(
                    "Strategy run failed: {} ({}/{} consecutive): {}",
                    strategyKey,
                    errorCount,
                    schedulerProperties.getMaxConsecutiveErrors(),
                    e.getMessage(),
                    e);
        } finally {
            if (context.getStrategyInstance() != null) {
                context.getStrategyInstance().resetState();
            }
        }
    }

    // ========================
    // STEPS
    // ========================

    void fetchMarketData(StrategyExecutionContext context) {
        List<OhlcvCandle> candles =
                marketDataFetcher.fetch(context.getExchange(), context.getSymbol(), context.getTimeframe());
        context.setCandles(candles);

        String seriesName = context.getExchangeName() + ":" + context.getSymbol() + ":" + context.getTimeframe();
        context.setSeries(
                BarSeriesFactory.fromCandles(seriesName, candles, Timeframe.intervalOf(context.getTimeframe())));
        if (!candles.isEmpty()) {
            priceBook.record(context.getExchangeName(), context.getSymbol(), candles.get(candles.size() - 1).close());
        }
        errorTracker.reset(context.strategyKey());
    }

    void computeIndicators(StrategyExecutionContext context) {
        BarSeries series = requireSeries(context);
        Map<String, Object> configured = context.getParameters().getMap(INDICATORS_PARAMETER);

        for (Map.Entry<String, Object> entry : configured.entrySet()) {
            String indicatorName = entry.getKey();
            try {
                PluginParameters indicatorParameters =
                        PluginParameters.of(asParameterMap(indicatorName, entry.getValue()));
                IndicatorSeries result = indicatorCache.getOrCompute(indicatorName, series, indicatorParameters, () -> {
                    IndicatorPlugin indicator = indicatorRegistry.createIndicatorInstance(indicatorName);
                    indicator.validateParameters(indicatorParameters);
                    return indicator.calculate(series, indicatorParameters);
                });
                context.getIndicators().put(indicatorName, result);
            } catch (RuntimeException e) {
                log.warn("Indicator {} skipped for {}: {}", indicatorName, context.strategyKey(), e.getMessage());
            }
        }
        log.debug("Computed {}/{} indicators for {}", context.getIndicators().size(), configured.size(),
                context.strategyKey());
    }

    void generateSignal(StrategyExecutionContext context) {
        BarSeries series = requireSeries(context);
        if (context.getStrategyInstance() == null) {
            throw new IllegalStateException("Strategy instance must be initialized before generating signals");
        }
        StrategySignal signal = context.getStrategyInstance()
                .generateSignal(new MarketData(series, context.getIndicators()), context.getParameters());
        if (signal == null) {
            throw new IllegalStateException(
                    "Strategy " + context.getDefinition().getPluginName() + " returned no signal");
        }
        context.setSignal(signal);
        log.info(
                "Signal for {}: {} (strength {})",
                context.strategyKey(),
                signal.getAction(),
                signal.getStrength());
    }

    void executeTrade(StrategyExecutionContext context) {
        StrategySignal signal = context.getSignal();
        if (context.isDryRun()) {
            log.info(
                    "[DRY RUN] Would {} {} on {} (strategy {}, strength {})",
                    signal.getAction(),
                    context.getSymbol(),
                    context.getExchangeName(),
                    context.getDefinition().getName(),
                    signal.getStrength());
            return;
        }

        try {
            OrderRequest request = buildOrderRequest(context, signal);

            if (schedulerProperties.isPreTradeRiskCheck() && !reducesOpenPosition(request)) {
                BigDecimal proposedValue = request.effectivePrice().multiply(request.getQuantity());
                List<RiskEvaluation> violations =
                        riskEngine.evaluateNewTradeRisk(request.getSymbol(), request.getExchange(), proposedValue);
                if (!violations.isEmpty()) {
                    tradingMetrics.recordOrderBlocked();
                    log.warn(
                            "Order blocked by risk check for {}: {}",
                            context.strategyKey(),
                            violations.stream().map(RiskEvaluation::getReason).collect(Collectors.joining("; ")));
                    return;
                }
            }

            Order order = tradingService.createOrder(request);
            context.setOrder(order);
            tradingMetrics.recordOrderSubmitted();
            log.info(
                    "Order placed for {}: id={} {} {} {} status={}",
                    context.strategyKey(),
                    order.getId(),
                    request.getSide(),
                    request.getQuantity(),
                    request.getSymbol(),
                    order.getStatus());
        } catch (Exception e) {
            context.setTradeError(e);
            tradingMetrics.recordOrderFailed();
            int errorCount = errorTracker.increment(context.strategyKey());
            log.error(
                    "Trade execution failed for {} (signal {}, {} consecutive): {}",
                    context.strategyKey(),
                    signal.getAction(),
                    errorCount,
                    e.getMessage(),
                    e);
        }
    }

    /**
     * MARKET by default; LIMIT when the signal carries {@code order_type=limit} and a price.
     * Quantity comes from the signal metadata, else the configured default. The last close
     * is the reference price for exposure sizing and paper fills.
     */
    OrderRequest buildOrderRequest(StrategyExecutionContext context, StrategySignal signal) {
        PluginParameters metadata = PluginParameters.of(signal.getMetadata());
        OrderSide side = signal.getAction().toOrderSide();
        OrderType type = "limit".equalsIgnoreCase(metadata.getString("order_type", "market"))
                ? OrderType.LIMIT
                : OrderType.MARKET;
        BigDecimal quantity = metadata.getDecimal("quantity", schedulerProperties.getDefaultOrderQuantity());
        BigDecimal price = type == OrderType.LIMIT ? metadata.getDecimal("price", null) : null;

        BarSeries series = requireSeries(context);
        BigDecimal lastClose = new BigDecimal(series.getLastBar().getClosePrice().toString());

        OrderRequest request = OrderRequest.builder()
                .exchange(context.getExchangeName())
                .symbol(context.getSymbol())
                .side(side)
                .type(type)
                .quantity(quantity)
                .price(price)
                .referencePrice(lastClose)
                .timeout(schedulerProperties.getOrderTimeout())
                .strategyId(context.getDefinition().getId())
                .build();
        request.validate();
        return request;
    }

    /** True when the request is on the opposite side of an open position for the same market. */
    boolean reducesOpenPosition(OrderRequest request) {
        Optional<Position> open = riskEngine.getPosition(request.getExchange(), request.getSymbol());
        if (open.isPresent() && open.get().getSide() != null && open.get().getSide() != request.getSide()) {
            log.debug("{} {} reduces open {} position, admission check skipped",
                    request.getSide(), request.getSymbol(), open.get().getSide());
            return true;
        }
        return false;
    }

    private static BarSeries requireSeries(StrategyExecutionContext context) {
        if (context.getSeries() == null) {
            throw new IllegalStateException("Market data must be fetched first for " + context.strategyKey());
        }
        return context.getSeries();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asParameterMap(String indicatorName, Object value) {
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new ValidationException("Parameters of indicator '" + indicatorName + "' must be an object");
    }
}
