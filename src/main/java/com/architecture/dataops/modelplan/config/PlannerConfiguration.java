package com.architecture.dataops.modelplan.config;

import com.architecture.dataops.modelplan.service.sql.JSqlParserToolkit;
import com.architecture.dataops.modelplan.service.sql.SqlToolkit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires planner defaults and the SQL toolkit from application.yml.
 * Callers that need different knobs build their own {@link PlannerConfig} and pass it per call.
 */
@Configuration
@Slf4j
public class PlannerConfiguration {

    @Value("${planner.default-lookback-days:30}")
    private int defaultLookbackDays;

    @Value("${planner.cost-per-compute-second:0.0007}")
    private double costPerComputeSecond;

    @Value("${planner.skip-cosmetic-changes:true}")
    private boolean skipCosmeticChanges;

    @Value("${planner.default-estimated-seconds:300}")
    private double defaultEstimatedSeconds;

    @Bean
    public PlannerConfig plannerConfig() {
        PlannerConfig config = PlannerConfig.builder()
                .defaultLookbackDays(defaultLookbackDays)
                .costPerComputeSecond(costPerComputeSecond)
                .skipCosmeticChanges(skipCosmeticChanges)
                .defaultEstimatedSeconds(defaultEstimatedSeconds)
                .build();
        config.validate();
        log.info("[Planner Config] lookback={}d, rate={}/s, skipCosmetic={}",
                defaultLookbackDays, costPerComputeSecond, skipCosmeticChanges);
        return config;
    }

    /**
     * JSqlParser-backed toolkit used for cosmetic-change detection and column extraction.
     */
    @Bean
    public SqlToolkit sqlToolkit() {
        return new JSqlParserToolkit();
    }
}
