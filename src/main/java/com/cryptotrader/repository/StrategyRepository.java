package com.cryptotrader.repository;

import com.cryptotrader.domain.model.StrategyDefinition;
import java.util.List;

/** Source of the strategies the scheduler runs. */
public interface StrategyRepository {

    /** Active strategies only, with {@code parameters_json} already parsed. */
    List<StrategyDefinition> getActiveStrategies();
}
