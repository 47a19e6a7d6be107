package org.nowstart.optimizer.data.dto;

import java.time.Duration;
import java.util.Optional;

public record SearchProgress(
        long total,
        long completed,
        long failed,
        double bestScore,
        Duration elapsed
) {

    public double percentage() {
        if (total <= 0) {
            return 0.0;
        }
        return (completed * 100.0) / total;
    }

    public Optional<Duration> estimatedRemaining() {
        if (completed <= 0) {
            return Optional.empty();
        }
        if (total <= completed) {
            return Optional.of(Duration.ZERO);
        }
        long perCandidateNanos = elapsed.toNanos() / completed;
        return Optional.of(Duration.ofNanos(perCandidateNanos * (total - completed)));
    }
}
