package com.architecture.dataops.modelplan.dto.plan;

import com.architecture.dataops.modelplan.config.PlannerConfig;
import com.architecture.dataops.modelplan.dto.contract.ContractValidationResult;
import com.architecture.dataops.modelplan.dto.diff.AstDiffDetail;
import com.architecture.dataops.modelplan.dto.diff.DiffResult;
import com.architecture.dataops.modelplan.dto.state.RunStatistics;
import com.architecture.dataops.modelplan.dto.state.Watermark;
import com.architecture.dataops.modelplan.model.DependencyGraph;
import com.architecture.dataops.modelplan.model.ModelDefinition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

/**
 * Everything the interval planner needs to turn a diff into a plan.
 * Optional inputs (baseSql, contractResults, astDiffs) may be left null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanRequest {

    // Target-snapshot models keyed by name
    @Builder.Default
    private Map<String, ModelDefinition> models = new HashMap<>();

    private DiffResult diffResult;
    private DependencyGraph dag;

    @Builder.Default
    private Map<String, Watermark> watermarks = new HashMap<>();

    @Builder.Default
    private Map<String, RunStatistics> runStats = new HashMap<>();

    // Null means PlannerConfig.defaults()
    private PlannerConfig config;

    @Builder.Default
    private String base = "";

    @Builder.Default
    private String target = "";

    // Required; the planner never reads the clock
    private LocalDate asOfDate;

    // Base-snapshot SQL keyed by model name, enables cosmetic filtering
    private Map<String, String> baseSql;

    private ContractValidationResult contractResults;

    private Map<String, AstDiffDetail> astDiffs;
}
