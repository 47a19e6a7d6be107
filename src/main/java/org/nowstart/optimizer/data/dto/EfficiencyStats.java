package org.nowstart.optimizer.data.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;

/**
 * Output of the efficiency analyzer for one candidate. Only {@code efficiencyScore} is
 * required; the multipliers and expectancy figures are optional and read with a 0.0 default.
 */
@Builder(toBuilder = true)
public record EfficiencyStats(
        double efficiencyScore,
        Double diversificationMultiplier,
        Double independenceMultiplier,
        Double activityMultiplier,
        Double totalExpectancy,
        Double weightedEfficiency,
        Double riskConcentrationIndex,
        Map<String, Object> additionalMetrics
) {

    public EfficiencyStats {
        additionalMetrics = additionalMetrics == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(additionalMetrics));
    }

    public static EfficiencyStats ofScore(double efficiencyScore) {
        return EfficiencyStats.builder().efficiencyScore(efficiencyScore).build();
    }

    public double diversificationMultiplierOrZero() {
        return orZero(diversificationMultiplier);
    }

    public double independenceMultiplierOrZero() {
        return orZero(independenceMultiplier);
    }

    public double activityMultiplierOrZero() {
        return orZero(activityMultiplier);
    }

    public double totalExpectancyOrZero() {
        return orZero(totalExpectancy);
    }

    public double weightedEfficiencyOrZero() {
        return orZero(weightedEfficiency);
    }

    public double riskConcentrationIndexOrZero() {
        return orZero(riskConcentrationIndex);
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }
}
