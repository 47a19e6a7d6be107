package org.nowstart.optimizer.data.dto;

import java.time.Instant;
import java.util.List;

/**
 * Per-strategy time series after loading and alignment: one position value per timestamp.
 */
public record StrategySeries(
        String strategyId,
        List<Instant> timestamps,
        List<Double> positions
) {

    public StrategySeries {
        timestamps = timestamps == null ? List.of() : List.copyOf(timestamps);
        positions = positions == null ? List.of() : List.copyOf(positions);
        if (timestamps.size() != positions.size()) {
            throw new IllegalArgumentException(
                    "timestamps and positions must have equal length for strategy=" + strategyId
            );
        }
    }

    public int length() {
        return timestamps.size();
    }
}
