package org.nowstart.optimizer.data.dto;

import java.nio.file.Path;
import java.util.Optional;

public record OptimizationOutcome(
        EfficiencyStats baselineStats,
        SearchResult searchResult,
        OptimizationReport report,
        Path reportPath
) {

    public boolean hasReport() {
        return report != null;
    }

    public Optional<Path> savedPath() {
        return Optional.ofNullable(reportPath);
    }
}
