package org.nowstart.optimizer.data.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.nowstart.optimizer.data.json.DefaultHorizonSerializer;

/**
 * Comparison between running every strategy together and running the best combination found.
 * Serialized as-is to {@code <portfolio-stem>_optimization.json}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({
        "optimization_summary",
        "all_strategies",
        "optimal_strategies",
        "config",
        "efficiency_calculation_note"
})
public record OptimizationReport(
        Summary optimizationSummary,
        StrategyGroup allStrategies,
        StrategyGroup optimalStrategies,
        ReportConfig config,
        String efficiencyCalculationNote
) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Summary(
            int allStrategiesCount,
            int optimalStrategiesCount,
            double allStrategiesEfficiency,
            double optimalStrategiesEfficiency,
            // null when the baseline score is zero or not finite
            Double efficiencyImprovementPercent,
            List<String> selectedStrategies
    ) {

        public Summary {
            selectedStrategies = selectedStrategies == null ? List.of() : List.copyOf(selectedStrategies);
        }

        public boolean improvementDefined() {
            return efficiencyImprovementPercent != null;
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record StrategyGroup(
            int strategyCount,
            List<String> tickers,
            List<String> strategyIds,
            double efficiencyScore,
            double diversificationMultiplier,
            double independenceMultiplier,
            double activityMultiplier,
            double totalExpectancy,
            double averageExpectancy,
            double weightedEfficiency,
            double riskConcentrationIndex,
            Map<String, Object> additionalMetrics
    ) {

        public StrategyGroup {
            tickers = tickers == null ? List.of() : List.copyOf(tickers);
            strategyIds = strategyIds == null ? List.of() : List.copyOf(strategyIds);
            additionalMetrics = additionalMetrics == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(additionalMetrics));
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ReportConfig(
            String portfolio,
            int minStrategiesPerPermutation,
            Integer maxStrategiesPerPermutation,
            Integer maxPermutations,
            @JsonSerialize(nullsUsing = DefaultHorizonSerializer.class) Integer horizon
    ) {
    }
}
