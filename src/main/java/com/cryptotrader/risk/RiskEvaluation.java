package com.cryptotrader.risk;

import com.cryptotrader.domain.enums.RiskAction;
import com.cryptotrader.domain.model.Position;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of a risk rule. Immutable: rules and metadata are copied on construction,
 * and the position is a snapshot taken when the rule ran.
 *
 * <p>{@code evaluationId} is passed to the trading engine with every action so
 * that executed orders can be traced back to the evaluation that caused them.
 */
@Getter
@ToString
public class RiskEvaluation {

    private final String evaluationId;
    private final RiskAction action;
    private final String reason;
    private final List<String> triggeredRules;
    private final Position position;
    private final Map<String, Object> metadata;
    private final Instant evaluatedAt;

    private RiskEvaluation(
            RiskAction action,
            String reason,
            List<String> triggeredRules,
            Position position,
            Map<String, Object> metadata,
            Instant evaluatedAt) {
        this.evaluationId = UUID.randomUUID().toString();
        this.action = action;
        this.reason = reason;
        this.triggeredRules = List.copyOf(triggeredRules);
        this.position = position != null ? position.copy() : null;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.evaluatedAt = evaluatedAt;
    }

    public static RiskEvaluation of(
            RiskAction action,
            String reason,
            List<String> triggeredRules,
            Position position,
            Map<String, Object> metadata,
            Instant evaluatedAt) {
        return new RiskEvaluation(action, reason, triggeredRules, position, metadata, evaluatedAt);
    }

    public static RiskEvaluation none(String reason, Instant evaluatedAt) {
        return new RiskEvaluation(RiskAction.NONE, reason, List.of(), null, Map.of(), evaluatedAt);
    }

    public boolean isActionable() {
        return action != RiskAction.NONE;
    }

    /** Returns a copy of the position snapshot, or null when the evaluation is portfolio-wide. */
    public Position getPosition() {
        return position != null ? position.copy() : null;
    }

    public Optional<Position> findPosition() {
        return Optional.ofNullable(getPosition());
    }
}
