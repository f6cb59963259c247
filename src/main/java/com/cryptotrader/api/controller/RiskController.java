package com.cryptotrader.api.controller;

import com.cryptotrader.api.dto.request.CheckIntervalRequest;
import com.cryptotrader.api.dto.request.CheckTradeRequest;
import com.cryptotrader.api.dto.request.EquityUpdateRequest;
import com.cryptotrader.domain.model.Position;
import com.cryptotrader.exception.ResourceNotFoundException;
import com.cryptotrader.risk.RiskEngine;
import com.cryptotrader.risk.RiskEvaluation;
import com.cryptotrader.risk.RiskEvaluationRecord;
import com.cryptotrader.risk.RiskMonitor;
import com.cryptotrader.risk.RiskMonitorStatistics;
import jakarta.validation.Valid;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the risk engine and monitor.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/risk/status -- pause flag, equity, drawdown and monitor statistics</li>
 *   <li>GET /api/risk/positions -- positions tracked by the engine</li>
 *   <li>GET /api/risk/positions/{exchange}?symbol=S -- one tracked position, 404 when none</li>
 *   <li>GET /api/risk/history?limit=N -- actionable evaluations, most recent first</li>
 *   <li>POST /api/risk/resume -- clears the trading pause</li>
 *   <li>POST /api/risk/check-trade -- runs the new-trade admission rules without trading</li>
 *   <li>POST /api/risk/equity -- reports current account equity</li>
 *   <li>PUT /api/risk/check-interval -- changes the monitor's check interval</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/risk")
public class RiskController {

    private static final Logger log = LoggerFactory.getLogger(RiskController.class);

    private final RiskEngine riskEngine;
    private final RiskMonitor riskMonitor;

    public RiskController(RiskEngine riskEngine, RiskMonitor riskMonitor) {
        this.riskEngine = riskEngine;
        this.riskMonitor = riskMonitor;
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getRiskStatus() {
        RiskMonitorStatistics statistics = riskMonitor.getStatistics();
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("tradingPaused", riskEngine.isTradingPaused());
        status.put("peakEquity", riskEngine.getPeakEquity());
        status.put("currentEquity", riskEngine.getCurrentEquity());
        status.put("monitorRunning", statistics.running());
        status.put("positionsMonitored", statistics.positionsMonitored());
        status.put("totalEvaluations", statistics.totalEvaluations());
        status.put("actionCounts", statistics.actionCounts());
        status.put("checkIntervalMillis", riskEngine.getConfig().riskCheckInterval().toMillis());
        status.put("emergencyOnlyMode", riskEngine.getConfig().emergencyOnlyMode());
        status.put("configVersion", riskEngine.getConfigVersion());
        return ResponseEntity.ok(status);
    }

    @GetMapping("/positions")
    public ResponseEntity<List<Position>> getPositions() {
        return ResponseEntity.ok(new ArrayList<>(riskEngine.getPositions().values()));
    }

    @GetMapping("/positions/{exchange}")
    public ResponseEntity<Position> getPosition(
            @PathVariable("exchange") String exchange, @RequestParam("symbol") String symbol) {
        return ResponseEntity.ok(riskEngine.getPosition(exchange, symbol)
                .orElseThrow(() -> ResourceNotFoundException.position(exchange, symbol)));
    }

    @GetMapping("/history")
    public ResponseEntity<List<RiskEvaluationRecord>> getHistory(
            @RequestParam(name = "limit", required = false) Integer limit) {
        return ResponseEntity.ok(riskMonitor.getEvaluationHistory(limit));
    }

    /** Clears the pause set by the drawdown rule. Safe to call when trading is not paused. */
    @PostMapping("/resume")
    public ResponseEntity<Map<String, Object>> resumeTrading() {
        log.info("Trading resume requested via API");
        riskEngine.resumeTrading();
        return ResponseEntity.ok(Map.of("tradingPaused", riskEngine.isTradingPaused()));
    }

    /** Evaluates a proposed trade. Violations are returned, not thrown; the response is 200 either way. */
    @PostMapping("/check-trade")
    public ResponseEntity<Map<String, Object>> checkTrade(@Valid @RequestBody CheckTradeRequest request) {
        List<RiskEvaluation> evaluations =
                riskMonitor.checkNewTrade(request.getSymbol(), request.getExchange(), request.getValue());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("allowed", evaluations.isEmpty());
        result.put("violations", evaluations.stream().map(RiskEvaluationRecord::from).toList());
        return ResponseEntity.ok(result);
    }

    @PostMapping("/equity")
    public ResponseEntity<Map<String, Object>> updateEquity(@Valid @RequestBody EquityUpdateRequest request) {
        riskEngine.updateEquity(request.getEquity());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("peakEquity", riskEngine.getPeakEquity());
        result.put("currentEquity", riskEngine.getCurrentEquity());
        return ResponseEntity.ok(result);
    }

    @PutMapping("/check-interval")
    public ResponseEntity<Map<String, Object>> updateCheckInterval(@Valid @RequestBody CheckIntervalRequest request) {
        riskMonitor.updateCheckInterval(Duration.ofMillis(request.getIntervalMillis()));
        return ResponseEntity.ok(Map.of(
                "checkIntervalMillis", riskEngine.getConfig().riskCheckInterval().toMillis(),
                "configVersion", riskEngine.getConfigVersion()));
    }
}
