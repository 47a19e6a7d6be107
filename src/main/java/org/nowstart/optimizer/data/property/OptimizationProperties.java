package org.nowstart.optimizer.data.property;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "optimizer")
public record OptimizationProperties(
        // Portfolio file name or identifier; its stem names the report file
        @DefaultValue("") String portfolio,
        // Smallest candidate size evaluated
        @Min(2) @DefaultValue("3") int minStrategies,
        // Largest candidate size; unset means exactly min-strategies
        @Min(2) Integer maxStrategies,
        // Stop after this many candidates; unset means no cap
        @Positive Integer maxPermutations,
        // Horizon echoed into the report; unset is written as the default horizon
        @Positive Integer horizon,
        // Directory the optimization report is written to
        @NotBlank @DefaultValue("json/concurrency/optimization") String outputDir,
        // Minimum interval between search progress log lines
        @Positive @DefaultValue("5") int progressLogSeconds,
        // Write the report file after a successful search
        @DefaultValue("true") boolean saveReport,
        // Maximum members of one sector inside a candidate
        @NotNull @DefaultValue Map<String, Integer> sectorLimits,
        // Ticker to sector lookup used by sector limits
        @NotNull @DefaultValue Map<String, String> tickerSectors
) {

    public OptimizationProperties {
        sectorLimits = sectorLimits == null ? Map.of() : Map.copyOf(sectorLimits);
        tickerSectors = tickerSectors == null ? Map.of() : Map.copyOf(tickerSectors);
    }
}
