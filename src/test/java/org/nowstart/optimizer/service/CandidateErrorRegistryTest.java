package org.nowstart.optimizer.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.optimizer.data.dto.CandidateFailure;
import org.nowstart.optimizer.data.exception.CandidateEvaluationException;

class CandidateErrorRegistryTest {

    private final CandidateErrorRegistry registry = new CandidateErrorRegistry();

    @Test
    void track_recordsRootCauseWithContext() {
        CandidateEvaluationException wrapped = new CandidateEvaluationException(
                List.of("AAPL_SMA_5_20", "MSFT_SMA_6_21"),
                new IllegalStateException("missing price history")
        );

        Instant before = Instant.now();
        registry.track(wrapped, "candidate_evaluation", Map.of("candidate_size", 2));

        assertThat(registry.count()).isEqualTo(1);
        CandidateFailure failure = registry.failures().get(0);
        assertThat(failure.operation()).isEqualTo("candidate_evaluation");
        assertThat(failure.exceptionType()).isEqualTo(IllegalStateException.class.getName());
        assertThat(failure.message()).isEqualTo("missing price history");
        assertThat(failure.context()).containsEntry("candidate_size", 2);
        assertThat(failure.occurredAt()).isAfterOrEqualTo(before);
    }

    @Test
    void track_toleratesMissingArguments() {
        registry.track(new IllegalArgumentException("bad"), null, null);
        registry.track(null, "candidate_evaluation", Map.of());

        assertThat(registry.failures()).hasSize(2);
        assertThat(registry.failures().get(0).context()).isEmpty();
        assertThat(registry.failures().get(1).exceptionType()).isNull();
    }

    @Test
    void failuresFor_filtersByOperationAndClearResets() {
        registry.track(new IllegalStateException("a"), "candidate_evaluation", Map.of());
        registry.track(new IllegalStateException("b"), "baseline", Map.of());
        registry.track(new IllegalStateException("c"), "candidate_evaluation", Map.of());

        assertThat(registry.failuresFor("candidate_evaluation"))
                .extracting(CandidateFailure::message)
                .containsExactly("a", "c");

        registry.clear();

        assertThat(registry.count()).isZero();
        assertThat(registry.failures()).isEmpty();
    }

    @Test
    void track_keepsOnlyMostRecentFailuresUpToCapacity() {
        CandidateErrorRegistry bounded = new CandidateErrorRegistry(2);

        bounded.track(new IllegalStateException("first"), "candidate_evaluation", Map.of());
        bounded.track(new IllegalStateException("second"), "candidate_evaluation", Map.of());
        bounded.track(new IllegalStateException("third"), "candidate_evaluation", Map.of());

        assertThat(bounded.count()).isEqualTo(2);
        assertThat(bounded.dropped()).isEqualTo(1);
        assertThat(bounded.failures())
                .extracting(CandidateFailure::message)
                .containsExactly("second", "third");

        bounded.clear();

        assertThat(bounded.dropped()).isZero();
    }

    @Test
    void constructor_rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new CandidateErrorRegistry(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
