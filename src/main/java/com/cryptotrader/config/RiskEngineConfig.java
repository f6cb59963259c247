package com.cryptotrader.config;

import com.cryptotrader.observability.TradingMetrics;
import com.cryptotrader.oms.TradingEngine;
import com.cryptotrader.risk.PositionProvider;
import com.cryptotrader.risk.PriceProvider;
import com.cryptotrader.risk.RiskActionHandler;
import com.cryptotrader.risk.RiskEngine;
import com.cryptotrader.risk.RiskMonitor;
import com.cryptotrader.risk.config.RiskConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the risk layer: the validated {@link RiskConfig} built from {@link RiskProperties},
 * and the {@link RiskMonitor} with whichever position/price providers and trading engine
 * the context offers. Without a trading engine the monitor still records evaluations,
 * it just has nobody to act on them.
 */
@Configuration
@EnableConfigurationProperties(RiskProperties.class)
public class RiskEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(RiskEngineConfig.class);

    @Bean
    public RiskConfig riskConfig(RiskProperties riskProperties) {
        RiskConfig riskConfig = riskProperties.toRiskConfig();
        log.info(
                "Risk config loaded: stopLoss={}%, takeProfit={}%, maxDrawdown={}%, checkInterval={}",
                riskConfig.stopLoss().percentage(),
                riskConfig.takeProfit().percentage(),
                riskConfig.drawdownControl().maxDrawdownPercentage(),
                riskConfig.riskCheckInterval());
        return riskConfig;
    }

    @Bean
    public RiskMonitor riskMonitor(
            RiskEngine riskEngine,
            ObjectProvider<PositionProvider> positionProvider,
            ObjectProvider<PriceProvider> priceProvider,
            ObjectProvider<TradingEngine> tradingEngine,
            TradingMetrics tradingMetrics) {
        RiskMonitor riskMonitor = new RiskMonitor(
                riskEngine, positionProvider.getIfUnique(), priceProvider.getIfUnique(), tradingMetrics);
        tradingEngine.ifUnique(engine -> new RiskActionHandler(engine).registerWith(riskMonitor));
        return riskMonitor;
    }
}
