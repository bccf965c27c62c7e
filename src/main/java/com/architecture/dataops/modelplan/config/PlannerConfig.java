package com.architecture.dataops.modelplan.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Tunable knobs for the interval planner. Always passed explicitly to the planner;
 * {@link #defaults()} builds the documented default values.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PlannerConfig {

    public static final int DEFAULT_LOOKBACK_DAYS = 30;
    public static final double DEFAULT_COST_PER_COMPUTE_SECOND = 0.0007;
    public static final double DEFAULT_ESTIMATED_SECONDS = 300.0;

    // Days to look back when an incremental model has no watermark
    @Builder.Default
    private int defaultLookbackDays = DEFAULT_LOOKBACK_DAYS;

    // USD per compute-second (m5d.large rate)
    @Builder.Default
    private double costPerComputeSecond = DEFAULT_COST_PER_COMPUTE_SECOND;

    // Drop modified models whose change is whitespace, formatting or comments only
    @Builder.Default
    private boolean skipCosmeticChanges = true;

    // Runtime assumed for models without run history
    @Builder.Default
    private double defaultEstimatedSeconds = DEFAULT_ESTIMATED_SECONDS;

    public static PlannerConfig defaults() {
        return PlannerConfig.builder().build();
    }

    public void validate() {
        if (defaultLookbackDays < 1) {
            throw new IllegalArgumentException("defaultLookbackDays must be >= 1, got " + defaultLookbackDays);
        }
        if (costPerComputeSecond < 0 || Double.isNaN(costPerComputeSecond)) {
            throw new IllegalArgumentException("costPerComputeSecond must be >= 0, got " + costPerComputeSecond);
        }
        if (defaultEstimatedSeconds < 0 || Double.isNaN(defaultEstimatedSeconds)) {
            throw new IllegalArgumentException("defaultEstimatedSeconds must be >= 0, got " + defaultEstimatedSeconds);
        }
    }
}
