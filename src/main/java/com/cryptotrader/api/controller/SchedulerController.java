package com.cryptotrader.api.controller;

import com.cryptotrader.core.engine.SchedulerStatus;
import com.cryptotrader.core.engine.StrategyScheduler;
import com.cryptotrader.indicator.IndicatorCache;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Read-only view of the strategy scheduler: per-strategy timing, error counts and cache stats. */
@RestController
@RequestMapping("/api/scheduler")
public class SchedulerController {

    private final StrategyScheduler strategyScheduler;
    private final IndicatorCache indicatorCache;

    public SchedulerController(StrategyScheduler strategyScheduler, IndicatorCache indicatorCache) {
        this.strategyScheduler = strategyScheduler;
        this.indicatorCache = indicatorCache;
    }

    @GetMapping("/status")
    public ResponseEntity<SchedulerStatus> getStatus() {
        return ResponseEntity.ok(strategyScheduler.getStatus());
    }

    @GetMapping("/indicator-cache")
    public ResponseEntity<Map<String, Object>> getIndicatorCacheStats() {
        IndicatorCache.CacheStats stats = indicatorCache.getStats();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("hits", stats.hits());
        result.put("misses", stats.misses());
        result.put("size", stats.size());
        result.put("maxSize", stats.maxSize());
        result.put("hitRate", stats.hitRate());
        return ResponseEntity.ok(result);
    }
}
