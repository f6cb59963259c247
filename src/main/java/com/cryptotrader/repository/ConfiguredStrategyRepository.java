package com.cryptotrader.repository;

import com.cryptotrader.config.StrategyCatalogProperties;
import com.cryptotrader.config.StrategyCatalogProperties.StrategyEntry;
import com.cryptotrader.domain.model.StrategyDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * Strategy repository backed by {@code cryptotrader.catalog.strategies} in application.yml.
 *
 * <p>Parameters are stored as a JSON object string and parsed on every read, so a bad
 * entry only drops that strategy (logged) instead of failing startup.
 */
@Repository
public class ConfiguredStrategyRepository implements StrategyRepository {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredStrategyRepository.class);
    private static final TypeReference<Map<String, Object>> PARAMETERS_TYPE = new TypeReference<>() {};

    private final StrategyCatalogProperties catalogProperties;
    private final ObjectMapper objectMapper;

    public ConfiguredStrategyRepository(StrategyCatalogProperties catalogProperties, ObjectMapper objectMapper) {
        this.catalogProperties = catalogProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<StrategyDefinition> getActiveStrategies() {
        List<StrategyDefinition> strategies = new ArrayList<>();
        for (StrategyEntry entry : catalogProperties.getStrategies()) {
            if (!entry.isActive()) {
                continue;
            }
            if (entry.getId() == null || entry.getPluginName() == null) {
                log.warn("Skipping catalog strategy without id or plugin name: {}", entry.getName());
                continue;
            }
            try {
                strategies.add(StrategyDefinition.builder()
                        .id(entry.getId())
                        .name(entry.getName() != null ? entry.getName() : entry.getId())
                        .pluginName(entry.getPluginName())
                        .parameters(parseParameters(entry.getParametersJson()))
                        .active(true)
                        .build());
            } catch (JsonProcessingException e) {
                log.error("Skipping strategy {}: invalid parameters JSON: {}", entry.getId(), e.getOriginalMessage());
            }
        }
        return strategies;
    }

    private Map<String, Object> parseParameters(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        Map<String, Object> parameters = objectMapper.readValue(json, PARAMETERS_TYPE);
        return parameters != null ? parameters : Map.of();
    }
}
