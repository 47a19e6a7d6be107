package org.nowstart.optimizer.data.dto;

import java.time.Duration;
import java.util.List;

/**
 * Best candidate found by an exhaustive search. When every candidate failed (or none was
 * generated) {@code bestCandidate} and {@code bestStats} are null and {@link #found()} is false.
 * <p>
 * {@code bestCandidate} holds the strategy records exactly as the caller passed them, with their
 * original allocations. {@code bestStats} was computed on the equal-weight copy of those records
 * (see {@link #evaluatedCandidate()}).
 */
public record SearchResult(
        Candidate bestCandidate,
        EfficiencyStats bestStats,
        List<StrategySeries> bestAlignedData,
        int evaluated,
        int failed,
        Duration elapsed
) {

    public SearchResult {
        bestAlignedData = bestAlignedData == null ? List.of() : List.copyOf(bestAlignedData);
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
        if ((bestCandidate == null) != (bestStats == null)) {
            throw new IllegalArgumentException("bestCandidate and bestStats must both be set or both be null");
        }
    }

    public static SearchResult empty(int evaluated, int failed, Duration elapsed) {
        return new SearchResult(null, null, List.of(), evaluated, failed, elapsed);
    }

    public boolean found() {
        return bestCandidate != null;
    }

    /**
     * The best candidate with the equal allocation its stats were computed on, or null when
     * nothing was found.
     */
    public Candidate evaluatedCandidate() {
        if (!found()) {
            return null;
        }
        double allocation = 1.0 / bestCandidate.size();
        return bestCandidate.map(strategy -> strategy.withAllocation(allocation));
    }

    public double bestScore() {
        return found() ? bestStats.efficiencyScore() : Double.NEGATIVE_INFINITY;
    }
}
