package org.nowstart.optimizer.service;

import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.optimizer.data.dto.CandidateFailure;
import org.nowstart.optimizer.service.port.CandidateErrorSink;
import org.springframework.stereotype.Component;

/**
 * Keeps the most recent failures reported by searches for later inspection. At most
 * {@code capacity} failures are retained; older ones are dropped first and counted in
 * {@link #dropped()}. Recording is synchronized so one registry may be shared by several searches.
 */
@Slf4j
@Component
public class CandidateErrorRegistry implements CandidateErrorSink {

    public static final int DEFAULT_CAPACITY = 1_000;

    private final int capacity;
    private final Deque<CandidateFailure> failures = new ArrayDeque<>();
    private long dropped;

    public CandidateErrorRegistry() {
        this(DEFAULT_CAPACITY);
    }

    CandidateErrorRegistry(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void track(Exception exception, String operation, Map<String, Object> context) {
        Throwable root = exception != null && exception.getCause() != null ? exception.getCause() : exception;
        if (failures.size() == capacity) {
            failures.removeFirst();
            dropped++;
        }
        failures.addLast(new CandidateFailure(
                operation,
                root == null ? null : root.getClass().getName(),
                root == null ? null : root.getMessage(),
                context,
                Instant.now()
        ));
    }

    public synchronized List<CandidateFailure> failures() {
        return List.copyOf(failures);
    }

    public synchronized int count() {
        return failures.size();
    }

    public synchronized long dropped() {
        return dropped;
    }

    public synchronized List<CandidateFailure> failuresFor(String operation) {
        return failures.stream()
                .filter(failure -> Objects.equals(failure.operation(), operation))
                .toList();
    }

    @PreDestroy
    public synchronized void clear() {
        if (!failures.isEmpty()) {
            log.debug("event=candidate_failures_cleared count={}", failures.size());
        }
        failures.clear();
        dropped = 0;
    }
}
