package com.architecture.dataops.modelplan.service.planner;

import com.architecture.dataops.modelplan.config.PlannerConfig;
import com.architecture.dataops.modelplan.dto.contract.ContractValidationResult;
import com.architecture.dataops.modelplan.dto.diff.AstDiffDetail;
import com.architecture.dataops.modelplan.dto.diff.DiffResult;
import com.architecture.dataops.modelplan.dto.plan.DateRange;
import com.architecture.dataops.modelplan.dto.plan.Plan;
import com.architecture.dataops.modelplan.dto.plan.PlanRequest;
import com.architecture.dataops.modelplan.dto.plan.PlanStep;
import com.architecture.dataops.modelplan.dto.plan.PlanSummary;
import com.architecture.dataops.modelplan.dto.plan.RunType;
import com.architecture.dataops.modelplan.dto.plan.StepContractViolation;
import com.architecture.dataops.modelplan.dto.plan.StepDiffDetail;
import com.architecture.dataops.modelplan.dto.state.RunStatistics;
import com.architecture.dataops.modelplan.dto.state.Watermark;
import com.architecture.dataops.modelplan.exception.CyclicDependencyException;
import com.architecture.dataops.modelplan.model.DependencyGraph;
import com.architecture.dataops.modelplan.model.ModelDefinition;
import com.architecture.dataops.modelplan.model.ModelKind;
import com.architecture.dataops.modelplan.service.sql.CosmeticCheck;
import com.architecture.dataops.modelplan.service.sql.SqlToolkit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Turns a structural diff into a deterministic execution plan.
 *
 * The same request always yields an identical plan: every collection is sorted by
 * model name, ids are content hashes, and date arithmetic is anchored on the
 * caller-supplied as-of date rather than the clock. When in doubt a model gets a
 * full refresh instead of being skipped.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IntervalPlanner {

    static final String REASON_ADDED = "new model added";
    static final String REASON_MODIFIED = "SQL logic changed";
    static final String REASON_DOWNSTREAM = "downstream of ";
    static final String REASON_POLICY = "included by planner policy";

    private final SqlToolkit sqlToolkit;
    private final DeterministicIdGenerator idGenerator;

    /**
     * Generate the plan for a request.
     *
     * @throws IllegalArgumentException if the as-of date is missing or state inputs are malformed
     */
    public Plan generatePlan(PlanRequest request) {
        if (request.getAsOfDate() == null) {
            throw new IllegalArgumentException("asOfDate is required for deterministic planning");
        }
        if (request.getDiffResult() == null) {
            throw new IllegalArgumentException("diffResult is required");
        }

        PlannerConfig config = request.getConfig() != null ? request.getConfig() : PlannerConfig.defaults();
        config.validate();

        Map<String, ModelDefinition> models = orEmpty(request.getModels());
        Map<String, Watermark> watermarks = orEmpty(request.getWatermarks());
        Map<String, RunStatistics> runStats = orEmpty(request.getRunStats());
        DependencyGraph dag = request.getDag() != null ? request.getDag() : DependencyGraph.create();
        DiffResult diff = request.getDiffResult();
        String base = request.getBase() != null ? request.getBase() : "";
        String target = request.getTarget() != null ? request.getTarget() : "";

        watermarks.forEach((name, watermark) -> watermark.validate(name));
        runStats.forEach((name, stats) -> stats.validate(name));

        log.info("Generating plan {} -> {} as of {} ({} added, {} modified)",
                base, target, request.getAsOfDate(),
                sizeOf(diff.getAddedModels()), sizeOf(diff.getModifiedModels()));

        // ========================= DIRECT CHANGES =========================
        Set<String> directlyChanged = new TreeSet<>();
        addAll(directlyChanged, diff.getAddedModels());
        addAll(directlyChanged, diff.getModifiedModels());

        Set<String> cosmeticModels = findCosmeticChanges(diff, models, request.getBaseSql(), config);
        directlyChanged.removeAll(cosmeticModels);

        // ========================= DOWNSTREAM CLOSURE =========================
        Set<String> allAffected = new TreeSet<>(directlyChanged);
        for (String modelName : directlyChanged) {
            if (dag.hasNode(modelName)) {
                allAffected.addAll(dag.descendants(modelName));
            }
        }
        allAffected.retainAll(models.keySet());
        List<String> affectedSorted = new ArrayList<>(allAffected);

        Map<String, Integer> parallelGroups = assignParallelGroups(affectedSorted, dag);

        // ========================= STEPS =========================
        Map<String, String> stepIds = new LinkedHashMap<>();
        for (String modelName : affectedSorted) {
            stepIds.put(modelName, idGenerator.generateStepId(modelName, base, target));
        }

        List<PlanStep> steps = new ArrayList<>(affectedSorted.size());
        for (String modelName : affectedSorted) {
            ModelDefinition model = models.get(modelName);
            List<String> affectedUpstreams = dag.predecessors(modelName).stream()
                    .filter(allAffected::contains)
                    .toList();

            RunType runType = determineRunType(modelName, model, diff);
            DateRange inputRange = runType == RunType.INCREMENTAL
                    ? computeIncrementalRange(modelName, watermarks, affectedUpstreams, config, request.getAsOfDate())
                    : null;

            double seconds = estimateSeconds(modelName, runStats, config);

            steps.add(PlanStep.builder()
                    .stepId(stepIds.get(modelName))
                    .model(modelName)
                    .runType(runType)
                    .inputRange(inputRange)
                    .dependsOn(affectedUpstreams.stream().map(stepIds::get).toList())
                    .parallelGroup(parallelGroups.getOrDefault(modelName, 0))
                    .reason(buildReason(modelName, diff, directlyChanged, dag))
                    .estimatedComputeSeconds(seconds)
                    .estimatedCostUsd(round6(seconds * config.getCostPerComputeSecond()))
                    .contractViolations(stepViolations(modelName, request.getContractResults()))
                    .diffDetail(stepDiffDetail(modelName, request.getAstDiffs()))
                    .build());
        }

        // ========================= SUMMARY =========================
        double totalCost = steps.stream().mapToDouble(PlanStep::getEstimatedCostUsd).sum();
        int totalViolations = steps.stream().mapToInt(s -> s.getContractViolations().size()).sum();
        int breakingViolations = (int) steps.stream()
                .flatMap(s -> s.getContractViolations().stream())
                .filter(v -> "BREAKING".equals(v.getSeverity()))
                .count();

        PlanSummary summary = PlanSummary.builder()
                .totalSteps(steps.size())
                .estimatedCostUsd(round6(totalCost))
                .modelsChanged(new ArrayList<>(affectedSorted))
                .cosmeticChangesSkipped(new ArrayList<>(cosmeticModels))
                .contractViolationsCount(totalViolations)
                .breakingContractViolations(breakingViolations)
                .build();

        String planId = idGenerator.generatePlanId(base, target, steps.stream().map(PlanStep::getStepId).toList());

        log.info("Plan {} generated: {} steps, {} cosmetic skips, estimated cost ${}",
                planId, steps.size(), cosmeticModels.size(), summary.getEstimatedCostUsd());

        return Plan.builder()
                .planId(planId)
                .base(base)
                .target(target)
                .summary(summary)
                .steps(steps)
                .build();
    }

    // ========================= COSMETIC FILTER =========================

    private Set<String> findCosmeticChanges(DiffResult diff, Map<String, ModelDefinition> models,
                                            Map<String, String> baseSql, PlannerConfig config) {
        Set<String> cosmetic = new TreeSet<>();
        if (!config.isSkipCosmeticChanges() || baseSql == null || diff.getModifiedModels() == null) {
            return cosmetic;
        }

        for (String modelName : new TreeSet<>(diff.getModifiedModels())) {
            if (!baseSql.containsKey(modelName) || !models.containsKey(modelName)) {
                continue;
            }
            CosmeticCheck check = sqlToolkit.classifyChange(baseSql.get(modelName), models.get(modelName).effectiveSql());
            if (check.isSkippable()) {
                cosmetic.add(modelName);
                log.info("Skipping {}: cosmetic-only change detected", modelName);
            } else if (check == CosmeticCheck.UNPARSEABLE) {
                log.warn("Could not classify change to {}; keeping it in the plan", modelName);
            }
        }
        return cosmetic;
    }

    // ========================= PARALLEL GROUPS =========================

    /**
     * Layer models by longest-path distance from a source in the subgraph induced by the
     * affected set. Models in the same layer have no mutual dependency.
     */
    Map<String, Integer> assignParallelGroups(List<String> affectedModels, DependencyGraph dag) {
        Map<String, Integer> groups = new HashMap<>();
        if (affectedModels.isEmpty()) {
            return groups;
        }

        DependencyGraph subgraph = dag.subgraph(affectedModels);
        if (subgraph.nodeCount() == 0) {
            affectedModels.forEach(m -> groups.put(m, 0));
            return groups;
        }

        List<String> topoOrder;
        try {
            topoOrder = subgraph.topologicalSort();
        } catch (CyclicDependencyException e) {
            log.warn("Cycle detected in affected subgraph; assigning sequential groups. {}", e.getMessage());
            for (int i = 0; i < affectedModels.size(); i++) {
                groups.put(affectedModels.get(i), i);
            }
            return groups;
        }

        Map<String, Integer> longestPath = new HashMap<>();
        for (String node : topoOrder) {
            int layer = subgraph.predecessors(node).stream()
                    .filter(longestPath::containsKey)
                    .mapToInt(p -> longestPath.get(p) + 1)
                    .max()
                    .orElse(0);
            longestPath.put(node, layer);
        }

        for (String modelName : affectedModels) {
            groups.put(modelName, longestPath.getOrDefault(modelName, 0));
        }
        return groups;
    }

    // ========================= RUN TYPE & RANGE =========================

    private RunType determineRunType(String modelName, ModelDefinition model, DiffResult diff) {
        if (diff.isAdded(modelName)) {
            return RunType.FULL_REFRESH;
        }
        ModelKind kind = model.getKind();
        if (kind == null) {
            return RunType.FULL_REFRESH;
        }
        return switch (kind) {
            case INCREMENTAL_BY_TIME_RANGE, APPEND_ONLY -> RunType.INCREMENTAL;
            case FULL_REFRESH, MERGE_BY_KEY -> RunType.FULL_REFRESH;
        };
    }

    /**
     * Resume from the model's watermark end (or look back from the as-of date), then widen
     * the start to cover any affected upstream whose watermark starts earlier.
     */
    private DateRange computeIncrementalRange(String modelName, Map<String, Watermark> watermarks,
                                              List<String> affectedUpstreams, PlannerConfig config,
                                              LocalDate asOfDate) {
        Watermark own = watermarks.get(modelName);
        LocalDate start = own != null
                ? own.getRangeEnd()
                : asOfDate.minusDays(config.getDefaultLookbackDays());

        for (String upstream : affectedUpstreams) {
            Watermark upstreamWatermark = watermarks.get(upstream);
            if (upstreamWatermark != null && upstreamWatermark.getRangeStart().isBefore(start)) {
                start = upstreamWatermark.getRangeStart();
            }
        }

        LocalDate end = asOfDate;
        if (start.isAfter(end)) {
            start = end;
        }
        return DateRange.of(start, end);
    }

    // ========================= COST =========================

    private double estimateSeconds(String modelName, Map<String, RunStatistics> runStats, PlannerConfig config) {
        RunStatistics stats = runStats.get(modelName);
        if (stats != null && stats.getAvgRuntimeSeconds() != null) {
            return stats.getAvgRuntimeSeconds();
        }
        return config.getDefaultEstimatedSeconds();
    }

    static double round6(double value) {
        return BigDecimal.valueOf(value).setScale(6, RoundingMode.HALF_EVEN).doubleValue();
    }

    // ========================= REASON =========================

    private String buildReason(String modelName, DiffResult diff, Set<String> directlyChanged, DependencyGraph dag) {
        if (diff.isAdded(modelName)) {
            return REASON_ADDED;
        }
        if (diff.isModified(modelName)) {
            return REASON_MODIFIED;
        }
        if (!directlyChanged.contains(modelName) && dag.hasNode(modelName)) {
            for (String upstream : dag.predecessors(modelName)) {
                if (directlyChanged.contains(upstream)) {
                    return REASON_DOWNSTREAM + upstream;
                }
            }
            SortedSet<String> ancestors = dag.ancestors(modelName);
            for (String ancestor : ancestors) {
                if (directlyChanged.contains(ancestor)) {
                    return REASON_DOWNSTREAM + ancestor;
                }
            }
        }
        return REASON_POLICY;
    }

    // ========================= ENRICHMENT =========================

    private List<StepContractViolation> stepViolations(String modelName, ContractValidationResult contractResults) {
        if (contractResults == null) {
            return new ArrayList<>();
        }
        return contractResults.violationsForModel(modelName).stream()
                .map(v -> StepContractViolation.builder()
                        .columnName(v.getColumnName())
                        .violationType(v.getViolationType())
                        .severity(v.getSeverity() != null ? v.getSeverity().name() : null)
                        .expected(v.getExpected())
                        .actual(v.getActual())
                        .message(v.getMessage())
                        .build())
                .toList();
    }

    private StepDiffDetail stepDiffDetail(String modelName, Map<String, AstDiffDetail> astDiffs) {
        if (astDiffs == null || !astDiffs.containsKey(modelName)) {
            return null;
        }
        AstDiffDetail detail = astDiffs.get(modelName);
        return StepDiffDetail.builder()
                .changeType(detail.getChangeType() != null ? detail.getChangeType().name() : null)
                .columnsAdded(new ArrayList<>(detail.getAddedColumns()))
                .columnsRemoved(new ArrayList<>(detail.getRemovedColumns()))
                .columnsModified(new ArrayList<>(detail.getChangedColumns()))
                .build();
    }

    private static <V> Map<String, V> orEmpty(Map<String, V> map) {
        return map != null ? map : Collections.emptyMap();
    }

    private static void addAll(Set<String> target, List<String> source) {
        if (source != null) {
            target.addAll(source);
        }
    }

    private static int sizeOf(List<String> list) {
        return list != null ? list.size() : 0;
    }
}
