package org.nowstart.optimizer.data.dto;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * One combination of strategies under evaluation. Member order follows the order of the
 * input list the candidate was drawn from; it carries no meaning beyond determinism.
 */
public record Candidate(List<StrategyConfig> strategies) {

    public Candidate {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("candidate must contain at least one strategy");
        }
        Map<StrategyConfig, Boolean> seen = new IdentityHashMap<>();
        for (StrategyConfig strategy : strategies) {
            if (strategy == null) {
                throw new IllegalArgumentException("candidate must not contain null strategies");
            }
            if (seen.put(strategy, Boolean.TRUE) != null) {
                throw new IllegalArgumentException("candidate must not repeat a strategy: " + strategy.strategyId());
            }
        }
        strategies = List.copyOf(strategies);
    }

    public static Candidate of(List<StrategyConfig> strategies) {
        return new Candidate(strategies);
    }

    public int size() {
        return strategies.size();
    }

    public List<String> tickers() {
        return strategies.stream().map(StrategyConfig::tickerOrUnknown).toList();
    }

    public List<String> strategyIds() {
        return strategies.stream().map(StrategyConfig::strategyId).toList();
    }

    public double totalAllocation() {
        return strategies.stream().mapToDouble(StrategyConfig::allocation).sum();
    }

    public Candidate map(UnaryOperator<StrategyConfig> mapper) {
        return new Candidate(strategies.stream().map(mapper).toList());
    }
}
