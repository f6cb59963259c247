package com.cryptotrader.risk;

import com.cryptotrader.domain.enums.RiskAction;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/** History entry kept by the {@link RiskMonitor} for every actionable evaluation. */
public record RiskEvaluationRecord(
        Instant timestamp,
        String evaluationId,
        RiskAction action,
        String reason,
        List<String> triggeredRules,
        String symbol,
        String exchange,
        Map<String, Object> metadata) {

    public static RiskEvaluationRecord from(RiskEvaluation evaluation) {
        return evaluation
                .findPosition()
                .map(position -> new RiskEvaluationRecord(
                        evaluation.getEvaluatedAt(),
                        evaluation.getEvaluationId(),
                        evaluation.getAction(),
                        evaluation.getReason(),
                        evaluation.getTriggeredRules(),
                        position.getSymbol(),
                        position.getExchange(),
                        evaluation.getMetadata()))
                .orElseGet(() -> new RiskEvaluationRecord(
                        evaluation.getEvaluatedAt(),
                        evaluation.getEvaluationId(),
                        evaluation.getAction(),
                        evaluation.getReason(),
                        evaluation.getTriggeredRules(),
                        null,
                        null,
                        evaluation.getMetadata()));
    }
}
