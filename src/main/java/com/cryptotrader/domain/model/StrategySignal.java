package com.cryptotrader.domain.model;

import com.cryptotrader.domain.enums.SignalAction;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Output of a strategy plugin for the latest bar.
 *
 * <p>Metadata keys understood by the execution pipeline: {@code quantity},
 * {@code order_type} ("market" or "limit"), {@code price} and {@code reason}.
 */
@Getter
@Builder
@ToString
public class StrategySignal {

    private final SignalAction action;

    /** Confidence between 0 and 1. */
    private final double strength;

    @Builder.Default
    private final Map<String, Object> metadata = Map.of();

    public static StrategySignal hold(String reason) {
        return StrategySignal.builder()
                .action(SignalAction.HOLD)
                .strength(0.0)
                .metadata(Map.of("reason", reason))
                .build();
    }
}
