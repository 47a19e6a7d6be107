package org.nowstart.optimizer.data.dto;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record CandidateFailure(
        String operation,
        String exceptionType,
        String message,
        Map<String, Object> context,
        Instant occurredAt
) {

    public CandidateFailure {
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }
}
