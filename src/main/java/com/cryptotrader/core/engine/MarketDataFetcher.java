package com.cryptotrader.core.engine;

import com.cryptotrader.config.SchedulerProperties;
import com.cryptotrader.domain.model.OhlcvCandle;
import com.cryptotrader.exception.BaseException;
import com.cryptotrader.exception.ValidationException;
import com.cryptotrader.exchange.ExchangeGateway;
import com.cryptotrader.observability.TradingMetrics;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fetches OHLCV candles with retry and exponential backoff.
 *
 * <p>Retry policy:
 * <ul>
 *   <li>{@code marketDataRetries} extra attempts after the first one</li>
 *   <li>Backoff starts at {@code retryInitialDelay}, doubles per attempt and is capped at
 *       {@code retryMaxDelay} (2s, 4s, 8s ... 30s with the defaults)</li>
 *   <li>Application exceptions are retried only when their {@link com.cryptotrader.exception.ErrorCode}
 *       is retryable (exchange unavailable); JDK argument/state exceptions are never retried</li>
 *   <li>An empty response is a validation error</li>
 * </ul>
 * When every attempt fails, the last exception is rethrown unchanged.
 */
@Component
public class MarketDataFetcher {

    private static final Logger log = LoggerFactory.getLogger(MarketDataFetcher.class);

    private final SchedulerProperties schedulerProperties;
    private final TradingMetrics tradingMetrics;
    private final RetryConfig retryConfig;

    public MarketDataFetcher(SchedulerProperties schedulerProperties, TradingMetrics tradingMetrics) {
        this.schedulerProperties = schedulerProperties;
        this.tradingMetrics = tradingMetrics;
        this.retryConfig = RetryConfig.custom()
                .maxAttempts(schedulerProperties.getMarketDataRetries() + 1)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        schedulerProperties.getRetryInitialDelay().toMillis(),
                        2.0,
                        schedulerProperties.getRetryMaxDelay().toMillis()))
                .retryOnException(MarketDataFetcher::isTransient)
                .ignoreExceptions(IllegalArgumentException.class, IllegalStateException.class)
                .build();
    }

    static boolean isTransient(Throwable failure) {
        if (failure instanceof BaseException applicationFailure) {
            return applicationFailure.getErrorCode().isRetryable();
        }
        return true;
    }

    public List<OhlcvCandle> fetch(ExchangeGateway exchange, String symbol, String timeframe) {
        Retry retry = Retry.of("market-data-" + exchange.name() + "-" + symbol, retryConfig);
        retry.getEventPublisher().onRetry(event -> {
            tradingMetrics.recordMarketDataRetry();
            log.warn(
                    "OHLCV fetch for {} {} failed (attempt {}), retrying in {}ms: {}",
                    symbol,
                    timeframe,
                    event.getNumberOfRetryAttempts(),
                    event.getWaitInterval().toMillis(),
                    String.valueOf(event.getLastThrowable()));
        });

        List<OhlcvCandle> candles = retry.executeSupplier(() -> {
            List<OhlcvCandle> rows = exchange.fetchOhlcv(symbol, timeframe, schedulerProperties.getCandleLimit());
            if (rows == null || rows.isEmpty()) {
                throw new ValidationException("No OHLCV data returned for " + symbol + " " + timeframe);
            }
            return rows;
        });
        log.debug("Fetched {} candles for {} {}", candles.size(), symbol, timeframe);
        return candles;
    }
}
