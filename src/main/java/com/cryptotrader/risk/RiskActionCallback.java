package com.cryptotrader.risk;

/**
 * Reaction to an actionable risk evaluation, registered on the {@link RiskMonitor}
 * per {@link com.cryptotrader.domain.enums.RiskAction}. Exceptions thrown here are
 * logged by the monitor and do not affect other callbacks.
 */
@FunctionalInterface
public interface RiskActionCallback {

    void onRiskAction(RiskEvaluation evaluation) throws Exception;
}
