package com.cryptotrader.config;

import com.cryptotrader.risk.config.DrawdownControlConfig;
import com.cryptotrader.risk.config.ExposureLimitConfig;
import com.cryptotrader.risk.config.MaxConcurrentTradesConfig;
import com.cryptotrader.risk.config.RiskConfig;
import com.cryptotrader.risk.config.StopLossConfig;
import com.cryptotrader.risk.config.TakeProfitConfig;
import com.cryptotrader.risk.config.TrailingStopConfig;
import java.math.BigDecimal;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Risk settings bound from application.yml under {@code cryptotrader.risk}.
 *
 * <p>This class is only the mutable binding target. {@link #toRiskConfig()} converts it
 * into the immutable, validated {@link RiskConfig} the engine works with, so an invalid
 * combination (e.g. activation below trailing percentage) fails application startup.
 */
@Data
@ConfigurationProperties(prefix = "cryptotrader.risk")
public class RiskProperties {

    /** Whether the risk monitor loop starts with the application. */
    private boolean monitorEnabled = true;

    private Duration checkInterval = Duration.ofSeconds(1);

    /** Only drawdown is monitored while set. */
    private boolean emergencyOnlyMode = false;

    private StopLoss stopLoss = new StopLoss();
    private TakeProfit takeProfit = new TakeProfit();
    private ExposureLimits exposureLimits = new ExposureLimits();
    private TrailingStop trailingStop = new TrailingStop();
    private MaxConcurrentTrades maxConcurrentTrades = new MaxConcurrentTrades();
    private DrawdownControl drawdownControl = new DrawdownControl();

    public RiskConfig toRiskConfig() {
        return RiskConfig.builder()
                .stopLoss(StopLossConfig.builder()
                        .enabled(stopLoss.enabled)
                        .percentage(stopLoss.percentage)
                        .cooldownSeconds(stopLoss.cooldownSeconds)
                        .trailing(stopLoss.trailing)
                        .build())
                .takeProfit(TakeProfitConfig.builder()
                        .enabled(takeProfit.enabled)
                        .percentage(takeProfit.percentage)
                        .cooldownSeconds(takeProfit.cooldownSeconds)
                        .partialClose(takeProfit.partialClose)
                        .partialClosePercentage(takeProfit.partialClosePercentage)
                        .build())
                .exposureLimits(ExposureLimitConfig.builder()
                        .maxPerAsset(exposureLimits.maxPerAsset)
                        .maxPerExchange(exposureLimits.maxPerExchange)
                        .maxTotal(exposureLimits.maxTotal)
                        .baseCurrency(exposureLimits.baseCurrency)
                        .build())
                .trailingStop(TrailingStopConfig.builder()
                        .enabled(trailingStop.enabled)
                        .trailingPercentage(trailingStop.trailingPercentage)
                        .activationPercentage(trailingStop.activationPercentage)
                        .cooldownSeconds(trailingStop.cooldownSeconds)
                        .build())
                .maxConcurrentTrades(MaxConcurrentTradesConfig.builder()
                        .maxTrades(maxConcurrentTrades.maxTrades)
                        .maxPerAsset(maxConcurrentTrades.maxPerAsset)
                        .maxPerExchange(maxConcurrentTrades.maxPerExchange)
                        .build())
                .drawdownControl(DrawdownControlConfig.builder()
                        .maxDrawdownPercentage(drawdownControl.maxDrawdownPercentage)
                        .enableEmergencyExit(drawdownControl.enableEmergencyExit)
                        .emergencyExitPercentage(drawdownControl.emergencyExitPercentage)
                        .pauseTradingOnBreach(drawdownControl.pauseTradingOnBreach)
                        .calculationPeriodDays(drawdownControl.calculationPeriodDays)
                        .build())
                .riskCheckInterval(checkInterval)
                .emergencyOnlyMode(emergencyOnlyMode)
                .build();
    }

    @Data
    public static class StopLoss {
        private boolean enabled = true;
        private BigDecimal percentage = new BigDecimal("2.0");
        private long cooldownSeconds = 60;
        private boolean trailing = false;
    }

    @Data
    public static class TakeProfit {
        private boolean enabled = true;
        private BigDecimal percentage = new BigDecimal("5.0");
        private long cooldownSeconds = 60;
        private boolean partialClose = false;
        private BigDecimal partialClosePercentage;
    }

    @Data
    public static class ExposureLimits {
        private BigDecimal maxPerAsset = new BigDecimal("1000");
        private BigDecimal maxPerExchange = new BigDecimal("5000");
        private BigDecimal maxTotal = new BigDecimal("10000");
        private String baseCurrency = "USDT";
    }

    @Data
    public static class TrailingStop {
        private boolean enabled = false;
        private BigDecimal trailingPercentage = new BigDecimal("2.0");
        private BigDecimal activationPercentage = new BigDecimal("3.0");
        private long cooldownSeconds = 60;
    }

    @Data
    public static class MaxConcurrentTrades {
        private int maxTrades = 5;
        private int maxPerAsset = 1;
        private int maxPerExchange = 3;
    }

    @Data
    public static class DrawdownControl {
        private BigDecimal maxDrawdownPercentage = new BigDecimal("15.0");
        private boolean enableEmergencyExit = true;
        private BigDecimal emergencyExitPercentage = new BigDecimal("25.0");
        private boolean pauseTradingOnBreach = true;
        private int calculationPeriodDays = 30;
    }
}
