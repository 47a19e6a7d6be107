package org.nowstart.optimizer.service;

import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.optimizer.data.dto.Candidate;
import org.nowstart.optimizer.data.dto.CandidateAnalysis;
import org.nowstart.optimizer.data.dto.OptimizationOutcome;
import org.nowstart.optimizer.data.dto.OptimizationReport;
import org.nowstart.optimizer.data.dto.OptimizationRequest;
import org.nowstart.optimizer.data.dto.SearchResult;
import org.nowstart.optimizer.data.dto.StrategyConfig;
import org.nowstart.optimizer.data.exception.CandidateEvaluationException;
import org.nowstart.optimizer.data.exception.OptimizationValidationException;
import org.nowstart.optimizer.data.property.OptimizationProperties;
import org.nowstart.optimizer.service.report.OptimizationReportBuilder;
import org.nowstart.optimizer.service.report.OptimizationReportWriter;
import org.springframework.stereotype.Service;

/**
 * Full optimization run for one portfolio: score the baseline of all strategies, search the
 * best combination, then build and save the comparison report.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioOptimizationService {

    private final CombinationGenerator combinationGenerator;
    private final CandidateEvaluator candidateEvaluator;
    private final OptimalCandidateSearchService optimalCandidateSearchService;
    private final OptimizationReportBuilder optimizationReportBuilder;
    private final OptimizationReportWriter optimizationReportWriter;
    private final OptimizationProperties optimizationProperties;

    public OptimizationOutcome optimize(List<StrategyConfig> strategies) {
        return optimize(strategies, OptimizationRequest.from(optimizationProperties), SearchProgressListener.NONE);
    }

    public OptimizationOutcome optimize(
            List<StrategyConfig> strategies,
            OptimizationRequest request,
            SearchProgressListener progressListener
    ) {
        if (strategies == null || strategies.isEmpty()) {
            throw new OptimizationValidationException("at least one strategy is required");
        }
        combinationGenerator.validateRange(strategies.size(), request.minStrategies(), request.maxStrategies());
        if (request.maxPermutations() != null && request.maxPermutations() <= 0) {
            throw new OptimizationValidationException("maxPermutations must be > 0, got: " + request.maxPermutations());
        }
        log.info(
                "event=optimization_start portfolio={} strategies={} min_strategies={} max_strategies={} max_permutations={}",
                request.portfolio(),
                strategies.size(),
                request.minStrategies(),
                request.maxStrategies(),
                request.maxPermutations()
        );

        CandidateAnalysis baseline = evaluateBaseline(strategies);
        SearchResult searchResult = optimalCandidateSearchService.findOptimalCandidate(
                strategies,
                request.minStrategies(),
                request.maxStrategies(),
                request.maxPermutations(),
                progressListener
        );

        if (!searchResult.found()) {
            log.warn(
                    "event=optimization_no_result portfolio={} evaluated={} failed={} fallback=all_strategies",
                    request.portfolio(),
                    searchResult.evaluated(),
                    searchResult.failed()
            );
            return new OptimizationOutcome(baseline.stats(), searchResult, null, null);
        }

        OptimizationReport report = optimizationReportBuilder.build(
                strategies,
                baseline.stats(),
                searchResult.bestCandidate().strategies(),
                searchResult.bestStats(),
                request
        );
        Path reportPath = optimizationProperties.saveReport()
                ? optimizationReportWriter.save(report, request)
                : null;
        return new OptimizationOutcome(baseline.stats(), searchResult, report, reportPath);
    }

    private CandidateAnalysis evaluateBaseline(List<StrategyConfig> strategies) {
        Candidate baseline = Candidate.of(strategies);
        try {
            CandidateAnalysis analysis = candidateEvaluator.evaluate(baseline);
            log.info(
                    "event=baseline_evaluated strategies={} efficiency_score={}",
                    baseline.size(),
                    analysis.stats().efficiencyScore()
            );
            return analysis;
        } catch (RuntimeException e) {
            log.error("event=baseline_failed strategies={} message={}", baseline.strategyIds(), e.getMessage(), e);
            throw new CandidateEvaluationException(baseline.strategyIds(), e);
        }
    }
}
