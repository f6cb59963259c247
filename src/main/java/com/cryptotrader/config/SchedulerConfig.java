package com.cryptotrader.config;

import com.cryptotrader.indicator.IndicatorCache;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
    SchedulerProperties.class,
    IndicatorProperties.class,
    StrategyCatalogProperties.class
})
public class SchedulerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public IndicatorCache indicatorCache(IndicatorProperties indicatorProperties) {
        return new IndicatorCache(indicatorProperties.getCacheSize());
    }
}
