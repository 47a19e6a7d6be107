package org.nowstart.optimizer.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.optimizer.TestStrategies;
import org.nowstart.optimizer.data.dto.Candidate;
import org.nowstart.optimizer.data.dto.CandidateAnalysis;
import org.nowstart.optimizer.data.dto.EfficiencyStats;
import org.nowstart.optimizer.data.dto.ProcessedCandidate;
import org.nowstart.optimizer.data.dto.StrategyConfig;
import org.nowstart.optimizer.data.dto.StrategySeries;
import org.nowstart.optimizer.service.port.EfficiencyAnalyzer;
import org.nowstart.optimizer.service.port.StrategyDataProcessor;

@ExtendWith(MockitoExtension.class)
class CandidateEvaluatorTest {

    @Mock
    private StrategyDataProcessor strategyDataProcessor;

    @Mock
    private EfficiencyAnalyzer efficiencyAnalyzer;

    @Test
    void evaluate_passesNormalizedCandidateAndReturnsAnalysisUnchanged() {
        CandidateEvaluator evaluator = new CandidateEvaluator(
                new AllocationNormalizer(),
                strategyDataProcessor,
                efficiencyAnalyzer
        );
        Candidate candidate = Candidate.of(TestStrategies.strategies(4));
        List<StrategySeries> data = List.of(series("AAPL_SMA_5_20"));
        CandidateAnalysis analysis = new CandidateAnalysis(EfficiencyStats.ofScore(0.42), data);
        when(strategyDataProcessor.process(any(Candidate.class)))
                .thenAnswer(invocation -> new ProcessedCandidate(data, invocation.getArgument(0)));
        when(efficiencyAnalyzer.analyze(eq(data), any(Candidate.class))).thenReturn(analysis);

        CandidateAnalysis result = evaluator.evaluate(candidate);

        assertThat(result).isSameAs(analysis);
        ArgumentCaptor<Candidate> processed = ArgumentCaptor.forClass(Candidate.class);
        verify(strategyDataProcessor).process(processed.capture());
        assertThat(processed.getValue().strategies())
                .extracting(StrategyConfig::allocation)
                .containsOnly(0.25);
    }

    @Test
    void evaluate_analyzesAlignedCandidateFromProcessor() {
        CandidateEvaluator evaluator = new CandidateEvaluator(
                new AllocationNormalizer(),
                strategyDataProcessor,
                efficiencyAnalyzer
        );
        List<StrategyConfig> strategies = TestStrategies.strategies(3);
        Candidate aligned = Candidate.of(strategies.subList(0, 2));
        when(strategyDataProcessor.process(any(Candidate.class))).thenReturn(new ProcessedCandidate(List.of(), aligned));
        when(efficiencyAnalyzer.analyze(anyList(), eq(aligned)))
                .thenReturn(new CandidateAnalysis(EfficiencyStats.ofScore(1.0), List.of()));

        CandidateAnalysis result = evaluator.evaluate(Candidate.of(strategies));

        assertThat(result.stats().efficiencyScore()).isEqualTo(1.0);
    }

    @Test
    void evaluate_propagatesProcessorFailureWithoutCallingAnalyzer() {
        CandidateEvaluator evaluator = new CandidateEvaluator(
                new AllocationNormalizer(),
                strategyDataProcessor,
                efficiencyAnalyzer
        );
        when(strategyDataProcessor.process(any(Candidate.class))).thenThrow(new IllegalStateException("no price data"));

        assertThatThrownBy(() -> evaluator.evaluate(Candidate.of(TestStrategies.strategies(2))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("no price data");
        verify(efficiencyAnalyzer, never()).analyze(anyList(), any(Candidate.class));
    }

    @Test
    void evaluate_propagatesAnalyzerFailure() {
        CandidateEvaluator evaluator = new CandidateEvaluator(
                new AllocationNormalizer(),
                strategyDataProcessor,
                efficiencyAnalyzer
        );
        when(strategyDataProcessor.process(any(Candidate.class)))
                .thenAnswer(invocation -> new ProcessedCandidate(List.of(), invocation.getArgument(0)));
        when(efficiencyAnalyzer.analyze(anyList(), any(Candidate.class))).thenThrow(new ArithmeticException("/ by zero"));

        assertThatThrownBy(() -> evaluator.evaluate(Candidate.of(TestStrategies.strategies(2))))
                .isInstanceOf(ArithmeticException.class);
    }

    private StrategySeries series(String strategyId) {
        return new StrategySeries(
                strategyId,
                List.of(Instant.parse("2026-01-01T00:00:00Z"), Instant.parse("2026-01-02T00:00:00Z")),
                List.of(0.0, 1.0)
        );
    }
}
