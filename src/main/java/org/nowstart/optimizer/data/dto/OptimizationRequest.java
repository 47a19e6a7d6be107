package org.nowstart.optimizer.data.dto;

import org.nowstart.optimizer.data.property.OptimizationProperties;

/**
 * Parameters of one optimization run: which portfolio it belongs to, the accepted candidate
 * sizes, the optional candidate cap and the optional default horizon echoed into the report.
 */
public record OptimizationRequest(
        String portfolio,
        int minStrategies,
        Integer maxStrategies,
        Integer maxPermutations,
        Integer horizon
) {

    public static OptimizationRequest from(OptimizationProperties properties) {
        return new OptimizationRequest(
                properties.portfolio(),
                properties.minStrategies(),
                properties.maxStrategies(),
                properties.maxPermutations(),
                properties.horizon()
        );
    }

    public static OptimizationRequest of(String portfolio, int minStrategies) {
        return new OptimizationRequest(portfolio, minStrategies, null, null, null);
    }
}
