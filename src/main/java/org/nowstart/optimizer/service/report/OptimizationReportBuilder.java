package org.nowstart.optimizer.service.report;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.optimizer.data.dto.EfficiencyStats;
import org.nowstart.optimizer.data.dto.OptimizationReport;
import org.nowstart.optimizer.data.dto.OptimizationRequest;
import org.nowstart.optimizer.data.dto.StrategyConfig;
import org.nowstart.optimizer.data.exception.OptimizationValidationException;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class OptimizationReportBuilder {

    static final String EFFICIENCY_CALCULATION_NOTE =
            "Efficiency score = diversification multiplier x independence multiplier x activity multiplier"
                    + " x weighted expectancy, computed with equal allocation (1 / strategy count) for every strategy"
                    + " in the group. Improvement is relative to running all strategies together.";

    public OptimizationReport build(
            List<StrategyConfig> allStrategies,
            EfficiencyStats allStats,
            List<StrategyConfig> optimalStrategies,
            EfficiencyStats optimalStats,
            OptimizationRequest request
    ) {
        if (allStrategies == null || optimalStrategies == null) {
            throw new OptimizationValidationException("strategy lists must not be null");
        }
        if (allStats == null || optimalStats == null) {
            throw new OptimizationValidationException("efficiency stats must not be null");
        }
        if (request == null) {
            throw new OptimizationValidationException("optimization request must not be null");
        }

        Double improvement = improvementPercent(allStats.efficiencyScore(), optimalStats.efficiencyScore());
        OptimizationReport.StrategyGroup allGroup = group(allStrategies, allStats);
        OptimizationReport.StrategyGroup optimalGroup = group(optimalStrategies, optimalStats);

        OptimizationReport report = new OptimizationReport(
                new OptimizationReport.Summary(
                        allStrategies.size(),
                        optimalStrategies.size(),
                        allStats.efficiencyScore(),
                        optimalStats.efficiencyScore(),
                        improvement,
                        optimalGroup.strategyIds()
                ),
                allGroup,
                optimalGroup,
                new OptimizationReport.ReportConfig(
                        request.portfolio(),
                        request.minStrategies(),
                        request.maxStrategies(),
                        request.maxPermutations(),
                        request.horizon()
                ),
                EFFICIENCY_CALCULATION_NOTE
        );

        log.info(
                "event=report_built portfolio={} all_count={} optimal_count={} all_efficiency={} optimal_efficiency={} improvement_pct={}",
                request.portfolio(),
                allStrategies.size(),
                optimalStrategies.size(),
                allStats.efficiencyScore(),
                optimalStats.efficiencyScore(),
                improvement == null ? "undefined" : improvement
        );
        return report;
    }

    /**
     * Relative change of the optimal score over the baseline, in percent. Returns null when
     * the baseline is zero or either score is not finite.
     */
    public Double improvementPercent(double baselineScore, double optimalScore) {
        if (baselineScore == 0.0 || !Double.isFinite(baselineScore) || !Double.isFinite(optimalScore)) {
            log.warn(
                    "event=improvement_undefined baseline_score={} optimal_score={}",
                    baselineScore,
                    optimalScore
            );
            return null;
        }
        return (optimalScore - baselineScore) / baselineScore * 100.0;
    }

    private OptimizationReport.StrategyGroup group(List<StrategyConfig> strategies, EfficiencyStats stats) {
        int count = strategies.size();
        double totalExpectancy = stats.totalExpectancyOrZero();
        double averageExpectancy = count == 0 ? 0.0 : totalExpectancy / count;
        return new OptimizationReport.StrategyGroup(
                count,
                strategies.stream().map(StrategyConfig::tickerOrUnknown).toList(),
                strategies.stream().map(StrategyConfig::strategyId).toList(),
                stats.efficiencyScore(),
                stats.diversificationMultiplierOrZero(),
                stats.independenceMultiplierOrZero(),
                stats.activityMultiplierOrZero(),
                totalExpectancy,
                averageExpectancy,
                stats.weightedEfficiencyOrZero(),
                stats.riskConcentrationIndexOrZero(),
                stats.additionalMetrics()
        );
    }
}
