package org.nowstart.optimizer.data.dto;

import java.util.List;

public record ProcessedCandidate(
        List<StrategySeries> data,
        Candidate alignedCandidate
) {

    public ProcessedCandidate {
        data = data == null ? List.of() : List.copyOf(data);
    }
}
