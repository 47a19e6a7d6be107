package org.nowstart.optimizer.data.dto;

import java.util.List;

public record CandidateAnalysis(
        EfficiencyStats stats,
        List<StrategySeries> alignedData
) {

    public CandidateAnalysis {
        if (stats == null) {
            throw new IllegalArgumentException("stats must not be null");
        }
        alignedData = alignedData == null ? List.of() : List.copyOf(alignedData);
    }
}
