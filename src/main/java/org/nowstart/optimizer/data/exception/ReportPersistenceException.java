package org.nowstart.optimizer.data.exception;

import java.nio.file.Path;
import lombok.Getter;

@Getter
public class ReportPersistenceException extends OptimizationException {

    public static final String CODE = "report_persistence_error";

    private final Path path;

    public ReportPersistenceException(Path path, Throwable cause) {
        super(CODE, "Failed to save optimization report to " + path, cause);
        this.path = path;
    }

}
