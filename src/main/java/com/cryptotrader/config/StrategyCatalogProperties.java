package com.cryptotrader.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Strategies defined in application.yml under {@code cryptotrader.catalog.strategies}.
 * Parameters are a JSON object string, the same shape a database-backed catalog stores.
 */
@Data
@ConfigurationProperties(prefix = "cryptotrader.catalog")
public class StrategyCatalogProperties {

    private List<StrategyEntry> strategies = new ArrayList<>();

    @Data
    public static class StrategyEntry {

        private String id;
        private String name;
        private String pluginName;

        /** JSON object with exchange, symbol, timeframe, indicators and plugin parameters. */
        private String parametersJson = "{}";

        private boolean active = true;
    }
}
