package org.nowstart.optimizer.config;

import org.nowstart.optimizer.data.property.OptimizationProperties;
import org.nowstart.optimizer.service.CandidateFilter;
import org.nowstart.optimizer.service.SectorLimitFilter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

@Configuration
@ComponentScan(basePackages = "org.nowstart.optimizer.service")
@EnableConfigurationProperties(OptimizationProperties.class)
public class OptimizationConfig {

    @Bean
    public CandidateFilter candidateFilter(OptimizationProperties optimizationProperties) {
        if (optimizationProperties.sectorLimits().isEmpty()) {
            return CandidateFilter.ACCEPT_ALL;
        }
        return new SectorLimitFilter(optimizationProperties.sectorLimits(), optimizationProperties.tickerSectors());
    }
}
