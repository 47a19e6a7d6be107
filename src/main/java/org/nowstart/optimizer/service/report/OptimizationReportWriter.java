package org.nowstart.optimizer.service.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.optimizer.data.dto.OptimizationReport;
import org.nowstart.optimizer.data.dto.OptimizationRequest;
import org.nowstart.optimizer.data.exception.OptimizationValidationException;
import org.nowstart.optimizer.data.exception.ReportPersistenceException;
import org.nowstart.optimizer.data.json.ReportObjectMapperFactory;
import org.nowstart.optimizer.data.property.OptimizationProperties;
import org.springframework.stereotype.Service;

/**
 * Writes an optimization report to {@code <output-dir>/<portfolio-stem>_optimization.json},
 * creating missing directories.
 */
@Slf4j
@Service
public class OptimizationReportWriter {

    static final String FILE_SUFFIX = "_optimization.json";

    private final ObjectMapper objectMapper = ReportObjectMapperFactory.create();
    private final OptimizationProperties optimizationProperties;

    public OptimizationReportWriter(OptimizationProperties optimizationProperties) {
        this.optimizationProperties = optimizationProperties;
    }

    public Path save(OptimizationReport report, OptimizationRequest request) {
        Path target = resolvePath(request.portfolio());
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(target.toFile(), report);
        } catch (IOException e) {
            log.error("event=report_save_failed path={} message={}", target.toAbsolutePath(), e.getMessage(), e);
            throw new ReportPersistenceException(target, e);
        }
        log.info("event=report_saved path={}", target.toAbsolutePath());
        return target;
    }

    public Path resolvePath(String portfolio) {
        String stem = portfolioStem(portfolio);
        try {
            return Path.of(optimizationProperties.outputDir()).resolve(stem + FILE_SUFFIX);
        } catch (InvalidPathException e) {
            throw new OptimizationValidationException("invalid report path for portfolio=" + portfolio);
        }
    }

    static String portfolioStem(String portfolio) {
        if (portfolio == null || portfolio.isBlank()) {
            throw new OptimizationValidationException("portfolio is required to name the optimization report");
        }
        String name = portfolio.trim().replace('\\', '/');
        int slash = name.lastIndexOf('/');
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        if (name.isBlank()) {
            throw new OptimizationValidationException("portfolio has no file name: " + portfolio);
        }
        return name;
    }
}
