package com.cryptotrader.risk;

import com.cryptotrader.domain.enums.RiskAction;
import java.util.Map;

public record RiskMonitorStatistics(
        long totalEvaluations, Map<RiskAction, Long> actionCounts, boolean running, int positionsMonitored) {}
