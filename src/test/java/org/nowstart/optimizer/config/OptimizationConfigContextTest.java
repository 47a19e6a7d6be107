package org.nowstart.optimizer.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.optimizer.TestStrategies;
import org.nowstart.optimizer.data.dto.CandidateAnalysis;
import org.nowstart.optimizer.data.dto.EfficiencyStats;
import org.nowstart.optimizer.data.dto.OptimizationOutcome;
import org.nowstart.optimizer.data.dto.ProcessedCandidate;
import org.nowstart.optimizer.data.property.OptimizationProperties;
import org.nowstart.optimizer.service.CandidateErrorRegistry;
import org.nowstart.optimizer.service.CandidateFilter;
import org.nowstart.optimizer.service.PortfolioOptimizationService;
import org.nowstart.optimizer.service.SectorLimitFilter;
import org.nowstart.optimizer.service.port.EfficiencyAnalyzer;
import org.nowstart.optimizer.service.port.StrategyDataProcessor;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

class OptimizationConfigContextTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
            .withUserConfiguration(AnalysisStubConfig.class, OptimizationConfig.class);

    @Test
    void contextLoadsWithDefaults() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(PortfolioOptimizationService.class);
            assertThat(context).hasSingleBean(CandidateErrorRegistry.class);
            assertThat(context.getBean(CandidateFilter.class)).isSameAs(CandidateFilter.ACCEPT_ALL);

            OptimizationProperties properties = context.getBean(OptimizationProperties.class);
            assertThat(properties.minStrategies()).isEqualTo(3);
            assertThat(properties.maxStrategies()).isNull();
            assertThat(properties.outputDir()).isEqualTo("json/concurrency/optimization");
            assertThat(properties.progressLogSeconds()).isEqualTo(5);
            assertThat(properties.saveReport()).isTrue();
            assertThat(properties.sectorLimits()).isEmpty();
        });
    }

    @Test
    void bindsPropertiesAndEnablesSectorLimits() {
        contextRunner
                .withPropertyValues(
                        "optimizer.portfolio=portfolios/core.csv",
                        "optimizer.min-strategies=2",
                        "optimizer.max-strategies=4",
                        "optimizer.max-permutations=50",
                        "optimizer.horizon=3",
                        "optimizer.save-report=false",
                        "optimizer.sector-limits.crypto=1",
                        "optimizer.ticker-sectors[BTC-USD]=crypto"
                )
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    OptimizationProperties properties = context.getBean(OptimizationProperties.class);
                    assertThat(properties.portfolio()).isEqualTo("portfolios/core.csv");
                    assertThat(properties.minStrategies()).isEqualTo(2);
                    assertThat(properties.maxStrategies()).isEqualTo(4);
                    assertThat(properties.maxPermutations()).isEqualTo(50);
                    assertThat(properties.horizon()).isEqualTo(3);
                    assertThat(properties.saveReport()).isFalse();
                    assertThat(properties.sectorLimits()).containsEntry("crypto", 1);
                    assertThat(context.getBean(CandidateFilter.class)).isInstanceOf(SectorLimitFilter.class);
                });
    }

    @Test
    void failsOnInvalidMinStrategies() {
        contextRunner
                .withPropertyValues("optimizer.min-strategies=1")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void runsOptimizationEndToEnd() {
        contextRunner
                .withPropertyValues("optimizer.portfolio=core.csv", "optimizer.min-strategies=2", "optimizer.save-report=false")
                .run(context -> {
                    OptimizationOutcome outcome = context.getBean(PortfolioOptimizationService.class)
                            .optimize(TestStrategies.strategies(4));

                    assertThat(outcome.hasReport()).isTrue();
                    assertThat(outcome.savedPath()).isEmpty();
                    assertThat(outcome.searchResult().evaluated()).isEqualTo(6);
                    assertThat(outcome.report().optimizationSummary().optimalStrategiesCount()).isEqualTo(2);
                    assertThat(outcome.report().optimizationSummary().selectedStrategies())
                            .containsExactly("BTC-USD_SMA_7_22", "ETH-USD_SMA_8_23");
                });
    }

    @Configuration(proxyBeanMethods = false)
    static class AnalysisStubConfig {

        @Bean
        StrategyDataProcessor strategyDataProcessor() {
            return candidate -> new ProcessedCandidate(List.of(), candidate);
        }

        @Bean
        EfficiencyAnalyzer efficiencyAnalyzer() {
            return (data, candidate) -> new CandidateAnalysis(
                    EfficiencyStats.ofScore(candidate.strategies().stream().mapToInt(s -> s.fastPeriod()).sum()),
                    data
            );
        }
    }
}
