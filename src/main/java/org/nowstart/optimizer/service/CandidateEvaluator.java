package org.nowstart.optimizer.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.optimizer.data.dto.Candidate;
import org.nowstart.optimizer.data.dto.CandidateAnalysis;
import org.nowstart.optimizer.data.dto.ProcessedCandidate;
import org.nowstart.optimizer.service.port.EfficiencyAnalyzer;
import org.nowstart.optimizer.service.port.StrategyDataProcessor;
import org.springframework.stereotype.Service;

/**
 * Runs one candidate through normalization, data loading and scoring. Exceptions from the
 * processor or analyzer are not caught here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CandidateEvaluator {

    private final AllocationNormalizer allocationNormalizer;
    private final StrategyDataProcessor strategyDataProcessor;
    private final EfficiencyAnalyzer efficiencyAnalyzer;

    public CandidateAnalysis evaluate(Candidate candidate) {
        Candidate normalized = allocationNormalizer.normalize(candidate);
        ProcessedCandidate processed = strategyDataProcessor.process(normalized);
        if (processed == null) {
            throw new IllegalStateException("Strategy data processor returned no data");
        }
        Candidate aligned = processed.alignedCandidate() != null ? processed.alignedCandidate() : normalized;
        CandidateAnalysis analysis = efficiencyAnalyzer.analyze(processed.data(), aligned);
        if (analysis == null) {
            throw new IllegalStateException("Efficiency analyzer returned no result");
        }
        log.debug(
                "event=candidate_evaluated strategies={} efficiency_score={}",
                aligned.strategyIds(),
                analysis.stats().efficiencyScore()
        );
        return analysis;
    }
}
