package com.cryptotrader.unit.controller;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.cryptotrader.api.controller.RiskController;
import com.cryptotrader.config.ApiResponseAdvice;
import com.cryptotrader.domain.enums.OrderSide;
import com.cryptotrader.exception.GlobalExceptionHandler;
import com.cryptotrader.observability.TradingMetrics;
import com.cryptotrader.risk.RiskEngine;
import com.cryptotrader.risk.RiskMonitor;
import com.cryptotrader.unit.support.MutableClock;
import com.cryptotrader.unit.support.RiskFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the RiskController, backed by a real engine and monitor.
 */
class RiskControllerTest {

    private MockMvc mockMvc;
    private RiskEngine riskEngine;

    @BeforeEach
    void setUp() {
        riskEngine = new RiskEngine(
                RiskFixtures.defaultConfig(), new MutableClock(Instant.parse("2024-03-01T12:00:00Z")));
        RiskMonitor riskMonitor =
                new RiskMonitor(riskEngine, null, null, new TradingMetrics(new SimpleMeterRegistry()));

        RiskController controller = new RiskController(riskEngine, riskMonitor);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("GET /api/risk/status returns engine and monitor state")
    void getRiskStatus() throws Exception {
        mockMvc.perform(get("/api/risk/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.tradingPaused").value(false))
                .andExpect(jsonPath("$.data.monitorRunning").value(false))
                .andExpect(jsonPath("$.data.positionsMonitored").value(0))
                .andExpect(jsonPath("$.data.checkIntervalMillis").value(50))
                .andExpect(jsonPath("$.data.configVersion").value(1));
    }

    @Test
    @DisplayName("POST /api/risk/equity tracks peak and current equity")
    void updateEquity() throws Exception {
        postEquity("100000");

        mockMvc.perform(post("/api/risk/equity")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{ \"equity\": 83000 }"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.peakEquity").value(100000))
                .andExpect(jsonPath("$.data.currentEquity").value(83000));
    }

    @Test
    @DisplayName("POST /api/risk/check-trade reports violations without placing anything")
    void checkTradeViolations() throws Exception {
        riskEngine.updatePosition(RiskFixtures.positionWithValue("binance", "BTC/USDT", "7500"));
        String body = """
                { "symbol": "BTC/USDT", "exchange": "binance", "value": 3000 }
                """;

        mockMvc.perform(post("/api/risk/check-trade")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.allowed").value(false))
                .andExpect(jsonPath("$.data.violations[0].action").value("BLOCK_NEW_TRADE"))
                .andExpect(jsonPath("$.data.violations[0].triggeredRules[0]").value("exposure_per_asset"));

        mockMvc.perform(get("/api/risk/history").param("limit", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(1));
    }

    @Test
    @DisplayName("POST /api/risk/check-trade allows a trade within limits")
    void checkTradeAllowed() throws Exception {
        String body = """
                { "symbol": "ETH/USDT", "exchange": "binance", "value": 500 }
                """;

        mockMvc.perform(post("/api/risk/check-trade")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.allowed").value(true))
                .andExpect(jsonPath("$.data.violations").isEmpty());
    }

    @Test
    @DisplayName("POST /api/risk/check-trade rejects a non-positive value")
    void checkTradeValidation() throws Exception {
        String body = """
                { "symbol": "ETH/USDT", "exchange": "binance", "value": -5 }
                """;

        mockMvc.perform(post("/api/risk/check-trade")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details.value").exists());
    }

    @Test
    @DisplayName("POST /api/risk/resume clears a drawdown pause")
    void resumeTrading() throws Exception {
        riskEngine.updateEquity(new BigDecimal("100000"));
        riskEngine.updateEquity(new BigDecimal("83000"));
        riskEngine.checkDrawdown();

        mockMvc.perform(post("/api/risk/resume"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.tradingPaused").value(false));
    }

    @Test
    @DisplayName("GET /api/risk/positions lists tracked positions")
    void getPositions() throws Exception {
        riskEngine.updatePosition(RiskFixtures.position(OrderSide.BUY, "50000", "51000"));

        mockMvc.perform(get("/api/risk/positions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].symbol").value("BTC/USDT"))
                .andExpect(jsonPath("$.data[0].highestPrice").value(51000));
    }

    @Test
    @DisplayName("GET /api/risk/positions/{exchange} returns one tracked position")
    void getPosition() throws Exception {
        riskEngine.updatePosition(RiskFixtures.position(OrderSide.BUY, "50000", "51000"));

        mockMvc.perform(get("/api/risk/positions/binance").param("symbol", "BTC/USDT"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.exchange").value("binance"))
                .andExpect(jsonPath("$.data.entryPrice").value(50000));
    }

    @Test
    @DisplayName("GET /api/risk/positions/{exchange} answers 404 POSITION_NOT_FOUND for an unknown symbol")
    void getPosition_notFound() throws Exception {
        mockMvc.perform(get("/api/risk/positions/binance").param("symbol", "SOL/USDT"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("POSITION_NOT_FOUND"))
                .andExpect(jsonPath("$.error.retryable").value(false))
                .andExpect(jsonPath("$.error.details.symbol").value("SOL/USDT"))
                .andExpect(jsonPath("$.error.path").value("/api/risk/positions/binance"));
    }

    @Test
    @DisplayName("PUT /api/risk/check-interval publishes a new config version")
    void updateCheckInterval() throws Exception {
        mockMvc.perform(put("/api/risk/check-interval")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{ \"intervalMillis\": 2000 }"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.checkIntervalMillis").value(2000))
                .andExpect(jsonPath("$.data.configVersion").value(2));
    }

    private void postEquity(String equity) throws Exception {
        mockMvc.perform(post("/api/risk/equity")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{ \"equity\": " + equity + " }"))
                .andExpect(status().isOk());
    }
}
