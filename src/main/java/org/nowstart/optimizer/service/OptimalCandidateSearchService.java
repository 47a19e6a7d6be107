package org.nowstart.optimizer.service;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.optimizer.data.dto.Candidate;
import org.nowstart.optimizer.data.dto.CandidateAnalysis;
import org.nowstart.optimizer.data.dto.EfficiencyStats;
import org.nowstart.optimizer.data.dto.SearchProgress;
import org.nowstart.optimizer.data.dto.SearchResult;
import org.nowstart.optimizer.data.dto.StrategyConfig;
import org.nowstart.optimizer.data.dto.StrategySeries;
import org.nowstart.optimizer.data.exception.CandidateEvaluationException;
import org.nowstart.optimizer.data.exception.OptimizationValidationException;
import org.nowstart.optimizer.data.property.OptimizationProperties;
import org.nowstart.optimizer.service.port.CandidateErrorSink;
import org.springframework.stereotype.Service;

/**
 * Evaluates every generated candidate in order and keeps the one with the highest efficiency
 * score. The first candidate to reach a score wins ties. A failing candidate is logged,
 * reported to the error sink and skipped; invalid size parameters fail the call immediately.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OptimalCandidateSearchService {

    public static final String OPERATION = "candidate_evaluation";

    private final CombinationGenerator combinationGenerator;
    private final CandidateEvaluator candidateEvaluator;
    private final CandidateErrorSink candidateErrorSink;
    private final CandidateFilter candidateFilter;
    private final OptimizationProperties optimizationProperties;

    public SearchResult findOptimalCandidate(List<StrategyConfig> strategies, int minSize) {
        return findOptimalCandidate(strategies, minSize, null, null, SearchProgressListener.NONE);
    }

    public SearchResult findOptimalCandidate(List<StrategyConfig> strategies, int minSize, Integer maxSize) {
        return findOptimalCandidate(strategies, minSize, maxSize, null, SearchProgressListener.NONE);
    }

    public SearchResult findOptimalCandidate(
            List<StrategyConfig> strategies,
            int minSize,
            Integer maxSize,
            Integer maxCandidates,
            SearchProgressListener progressListener
    ) {
        if (maxCandidates != null && maxCandidates <= 0) {
            throw new OptimizationValidationException("maxCandidates must be > 0, got: " + maxCandidates);
        }
        Stream<Candidate> candidates = combinationGenerator.generate(strategies, minSize, maxSize);
        long candidateCount = combinationGenerator.count(strategies.size(), minSize, maxSize);
        SearchProgressListener listener = progressListener != null ? progressListener : SearchProgressListener.NONE;

        log.info(
                "event=search_start strategies={} min_size={} max_size={} max_candidates={} candidates={}",
                strategies.size(),
                minSize,
                maxSize == null ? minSize : maxSize,
                maxCandidates,
                candidateCount == Long.MAX_VALUE ? "overflow" : candidateCount
        );

        SearchState state = new SearchState(
                candidateCount,
                maxCandidates,
                System.nanoTime(),
                optimizationProperties.progressLogSeconds()
        );
        Iterator<Candidate> iterator = candidates.iterator();
        while (iterator.hasNext()) {
            if (maxCandidates != null && state.evaluated >= maxCandidates) {
                log.info("event=search_cap_reached max_candidates={}", maxCandidates);
                break;
            }
            Candidate candidate = iterator.next();
            if (!candidateFilter.accept(candidate)) {
                state.skipped++;
                listener.onProgress(state.progress());
                continue;
            }
            state.evaluated++;
            evaluateCandidate(candidate, state);
            listener.onProgress(state.progress());
            logProgress(state);
        }

        return finish(state);
    }

    private void evaluateCandidate(Candidate candidate, SearchState state) {
        CandidateAnalysis analysis;
        try {
            analysis = candidateEvaluator.evaluate(candidate);
        } catch (Exception e) {
            state.failed++;
            CandidateEvaluationException failure = new CandidateEvaluationException(candidate.strategyIds(), e);
            log.error(
                    "event=candidate_failed failure_count={} strategies={} message=\"Error analyzing candidate: {}\"",
                    state.failed,
                    candidate.strategyIds(),
                    failure.getMessage()
            );
            log.debug("event=candidate_failed_trace strategies={}", candidate.strategyIds(), e);
            trackFailure(failure, candidate, state);
            return;
        }

        double score = analysis.stats().efficiencyScore();
        if (score > state.bestScore) {
            state.bestScore = score;
            state.bestCandidate = candidate;
            state.bestStats = analysis.stats();
            state.bestAlignedData = analysis.alignedData();
            log.debug("event=candidate_improved efficiency_score={} strategies={}", score, candidate.strategyIds());
        }
    }

    private void trackFailure(CandidateEvaluationException failure, Candidate candidate, SearchState state) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("strategy_ids", candidate.strategyIds());
        context.put("candidate_size", candidate.size());
        context.put("candidate_index", state.evaluated);
        context.put("failure_count", state.failed);
        try {
            candidateErrorSink.track(failure, OPERATION, context);
        } catch (RuntimeException sinkError) {
            log.warn("event=error_sink_failed operation={} strategies={}", OPERATION, candidate.strategyIds(), sinkError);
        }
    }

    private SearchResult finish(SearchState state) {
        Duration elapsed = state.elapsed();
        log.info(
                "event=search_done evaluated={} failed={} skipped={} best_score={} best_strategies={} elapsed_sec={}",
                state.evaluated,
                state.failed,
                state.skipped,
                state.bestCandidate == null ? "none" : state.bestScore,
                state.bestCandidate == null ? List.of() : state.bestCandidate.strategyIds(),
                formatSeconds(elapsed)
        );
        if (state.bestCandidate == null) {
            if (state.evaluated > 0) {
                log.warn("event=search_empty evaluated={} failed={}", state.evaluated, state.failed);
            }
            return SearchResult.empty(state.evaluated, state.failed, elapsed);
        }
        return new SearchResult(
                state.bestCandidate,
                state.bestStats,
                state.bestAlignedData,
                state.evaluated,
                state.failed,
                elapsed
        );
    }

    private void logProgress(SearchState state) {
        long now = System.nanoTime();
        if (now < state.nextLogAtNanos) {
            return;
        }
        state.nextLogAtNanos = now + state.logIntervalNanos;
        SearchProgress progress = state.progress();
        log.info(
                "event=search_progress done={}/{} pct={} failed={} best_score={} eta_sec={}",
                progress.completed(),
                progress.total(),
                String.format(Locale.US, "%.2f", progress.percentage()),
                progress.failed(),
                state.bestCandidate == null ? "none" : state.bestScore,
                progress.estimatedRemaining().map(this::formatSeconds).orElse("unknown")
        );
    }

    private String formatSeconds(Duration duration) {
        return String.format(Locale.US, "%.2f", duration.toNanos() / 1_000_000_000.0);
    }

    private static final class SearchState {

        private final long candidateCount;
        private final Integer maxCandidates;
        private final long startedAtNanos;
        private final long logIntervalNanos;
        private long nextLogAtNanos;
        private int evaluated;
        private int failed;
        private int skipped;
        private double bestScore = Double.NEGATIVE_INFINITY;
        private Candidate bestCandidate;
        private EfficiencyStats bestStats;
        private List<StrategySeries> bestAlignedData = List.of();

        private SearchState(long candidateCount, Integer maxCandidates, long startedAtNanos, int progressLogSeconds) {
            this.candidateCount = candidateCount;
            this.maxCandidates = maxCandidates;
            this.startedAtNanos = startedAtNanos;
            this.logIntervalNanos = TimeUnit.SECONDS.toNanos(progressLogSeconds);
            this.nextLogAtNanos = startedAtNanos + logIntervalNanos;
        }

        private Duration elapsed() {
            return Duration.ofNanos(System.nanoTime() - startedAtNanos);
        }

        private SearchProgress progress() {
            return new SearchProgress(total(), evaluated, failed, bestScore, elapsed());
        }

        // excludes filtered candidates
        private long total() {
            long remaining = candidateCount == Long.MAX_VALUE ? Long.MAX_VALUE : candidateCount - skipped;
            return maxCandidates == null ? remaining : Math.min(remaining, maxCandidates);
        }
    }
}
