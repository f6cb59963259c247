package com.cryptotrader.risk;

import com.cryptotrader.domain.enums.RiskAction;
import com.cryptotrader.domain.model.Position;
import com.cryptotrader.risk.config.DrawdownControlConfig;
import com.cryptotrader.risk.config.ExposureLimitConfig;
import com.cryptotrader.risk.config.MaxConcurrentTradesConfig;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure portfolio-level rules: exposure caps, concurrent trade caps and equity drawdown.
 * Inputs are snapshots; the caller owns any state change that follows a result.
 */
public final class PortfolioRiskRules {

    public static final String EXPOSURE_PER_ASSET = "exposure_per_asset";
    public static final String EXPOSURE_PER_EXCHANGE = "exposure_per_exchange";
    public static final String EXPOSURE_TOTAL = "exposure_total";
    public static final String MAX_PER_ASSET = "max_per_asset";
    public static final String MAX_PER_EXCHANGE = "max_per_exchange";
    public static final String MAX_TOTAL_TRADES = "max_total_trades";
    public static final String DRAWDOWN_EMERGENCY = "drawdown_emergency";
    public static final String DRAWDOWN_MAX = "drawdown_max";

    private PortfolioRiskRules() {}

    public static RiskEvaluation exposure(
            Collection<Position> positions,
            String symbol,
            String exchange,
            BigDecimal proposedValue,
            ExposureLimitConfig config,
            Instant now) {
        BigDecimal assetExposure = BigDecimal.ZERO;
        BigDecimal exchangeExposure = BigDecimal.ZERO;
        BigDecimal totalExposure = BigDecimal.ZERO;

        for (Position position : positions) {
            BigDecimal value = position.getValue() != null ? position.getValue() : BigDecimal.ZERO;
            totalExposure = totalExposure.add(value);
            if (exchange.equals(position.getExchange())) {
                exchangeExposure = exchangeExposure.add(value);
            }
            if (symbol.equals(position.getSymbol())) {
                assetExposure = assetExposure.add(value);
            }
        }

        BigDecimal newAsset = assetExposure.add(proposedValue);
        BigDecimal newExchange = exchangeExposure.add(proposedValue);
        BigDecimal newTotal = totalExposure.add(proposedValue);

        List<String> triggered = new ArrayList<>();
        List<String> reasons = new ArrayList<>();
        if (newAsset.compareTo(config.maxPerAsset()) > 0) {
            triggered.add(EXPOSURE_PER_ASSET);
            reasons.add("Asset exposure would be " + newAsset.toPlainString() + " > " + config.maxPerAsset());
        }
        if (newExchange.compareTo(config.maxPerExchange()) > 0) {
            triggered.add(EXPOSURE_PER_EXCHANGE);
            reasons.add("Exchange exposure would be " + newExchange.toPlainString() + " > " + config.maxPerExchange());
        }
        if (newTotal.compareTo(config.maxTotal()) > 0) {
            triggered.add(EXPOSURE_TOTAL);
            reasons.add("Total exposure would be " + newTotal.toPlainString() + " > " + config.maxTotal());
        }

        if (triggered.isEmpty()) {
            return RiskEvaluation.none("Exposure limits OK", now);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("current_asset_exposure", assetExposure);
        metadata.put("current_exchange_exposure", exchangeExposure);
        metadata.put("current_total_exposure", totalExposure);
        metadata.put("proposed_value", proposedValue);
        metadata.put("base_currency", config.baseCurrency());
        return RiskEvaluation.of(
                RiskAction.BLOCK_NEW_TRADE,
                "Exposure limits: " + String.join("; ", reasons),
                triggered,
                null,
                metadata,
                now);
    }

    public static RiskEvaluation concurrentTrades(
            Collection<Position> positions,
            String symbol,
            String exchange,
            MaxConcurrentTradesConfig config,
            Instant now) {
        int totalTrades = positions.size();
        long exchangeTrades = positions.stream()
                .filter(p -> exchange.equals(p.getExchange()))
                .count();
        long assetTrades =
                positions.stream().filter(p -> symbol.equals(p.getSymbol())).count();

        List<String> triggered = new ArrayList<>();
        List<String> reasons = new ArrayList<>();
        if (assetTrades >= config.maxPerAsset()) {
            triggered.add(MAX_PER_ASSET);
            reasons.add(assetTrades + " trade(s) already open for " + symbol + " (max: " + config.maxPerAsset() + ")");
        }
        if (exchangeTrades >= config.maxPerExchange()) {
            triggered.add(MAX_PER_EXCHANGE);
            reasons.add(exchangeTrades + " trade(s) already open on " + exchange + " (max: " + config.maxPerExchange()
                    + ")");
        }
        if (totalTrades >= config.maxTrades()) {
            triggered.add(MAX_TOTAL_TRADES);
            reasons.add(totalTrades + " trade(s) already open (max: " + config.maxTrades() + ")");
        }

        if (triggered.isEmpty()) {
            return RiskEvaluation.none("Concurrent trade limits OK", now);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("total_trades", totalTrades);
        metadata.put("exchange_trades", exchangeTrades);
        metadata.put("asset_trades", assetTrades);
        return RiskEvaluation.of(
                RiskAction.BLOCK_NEW_TRADE,
                "Concurrent trade limits: " + String.join("; ", reasons),
                triggered,
                null,
                metadata,
                now);
    }

    /**
     * Drawdown from peak equity. The emergency threshold is checked first so a deep
     * drawdown escalates straight to an exit instead of a pause.
     */
    public static RiskEvaluation drawdown(
            BigDecimal peakEquity, BigDecimal currentEquity, DrawdownControlConfig config, Instant now) {
        if (peakEquity == null || peakEquity.signum() <= 0 || currentEquity == null) {
            return RiskEvaluation.none("Peak equity not set", now);
        }

        BigDecimal drawdownPct = peakEquity
                .subtract(currentEquity)
                .divide(peakEquity, MathContext.DECIMAL64)
                .multiply(PositionRiskRules.HUNDRED);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("drawdown_pct", drawdownPct);
        metadata.put("peak_equity", peakEquity);
        metadata.put("current_equity", currentEquity);

        if (config.enableEmergencyExit() && drawdownPct.compareTo(config.emergencyExitPercentage()) >= 0) {
            return RiskEvaluation.of(
                    RiskAction.EMERGENCY_EXIT_ALL,
                    "Emergency drawdown: " + PositionRiskRules.format(drawdownPct) + "% (emergency threshold: "
                            + config.emergencyExitPercentage().toPlainString() + "%)",
                    List.of(DRAWDOWN_EMERGENCY),
                    null,
                    metadata,
                    now);
        }

        if (drawdownPct.compareTo(config.maxDrawdownPercentage()) >= 0 && config.pauseTradingOnBreach()) {
            return RiskEvaluation.of(
                    RiskAction.PAUSE_TRADING,
                    "Max drawdown breached: " + PositionRiskRules.format(drawdownPct) + "%",
                    List.of(DRAWDOWN_MAX),
                    null,
                    metadata,
                    now);
        }

        return RiskEvaluation.none("Drawdown within limits", now);
    }
}
