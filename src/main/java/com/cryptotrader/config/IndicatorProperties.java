package com.cryptotrader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "cryptotrader.indicators")
public class IndicatorProperties {

    /** Maximum number of calculated indicators kept in the LRU cache. */
    private int cacheSize = 128;
}
