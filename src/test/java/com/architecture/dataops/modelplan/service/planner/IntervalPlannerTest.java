package com.architecture.dataops.modelplan.service.planner;

import com.architecture.dataops.modelplan.config.PlannerConfig;
import com.architecture.dataops.modelplan.dto.contract.ContractValidationResult;
import com.architecture.dataops.modelplan.dto.contract.ContractViolation;
import com.architecture.dataops.modelplan.dto.contract.ViolationSeverity;
import com.architecture.dataops.modelplan.dto.diff.AstDiffDetail;
import com.architecture.dataops.modelplan.dto.diff.ChangeType;
import com.architecture.dataops.modelplan.dto.diff.DiffResult;
import com.architecture.dataops.modelplan.dto.plan.Plan;
import com.architecture.dataops.modelplan.dto.plan.PlanRequest;
import com.architecture.dataops.modelplan.dto.plan.PlanStep;
import com.architecture.dataops.modelplan.dto.plan.RunType;
import com.architecture.dataops.modelplan.dto.state.RunStatistics;
import com.architecture.dataops.modelplan.dto.state.Watermark;
import com.architecture.dataops.modelplan.model.DependencyGraph;
import com.architecture.dataops.modelplan.model.ModelDefinition;
import com.architecture.dataops.modelplan.model.ModelKind;
import com.architecture.dataops.modelplan.service.sql.CosmeticCheck;
import com.architecture.dataops.modelplan.service.sql.SqlToolkit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith({MockitoExtension.class, OutputCaptureExtension.class})
class IntervalPlannerTest {

    private static final LocalDate AS_OF = LocalDate.of(2024, 6, 1);

    @Mock
    private SqlToolkit sqlToolkit;

    private IntervalPlanner planner;

    @BeforeEach
    void setUp() {
        planner = new IntervalPlanner(sqlToolkit, new DeterministicIdGenerator());
    }

    // ========================= CLOSURE & GROUPS =========================

    @Test
    void plansModifiedModelAndItsDownstreamChain_butNotUnrelatedModels() {
        Map<String, ModelDefinition> models = models(
                model("A", ModelKind.FULL_REFRESH),
                model("B", ModelKind.FULL_REFRESH),
                model("C", ModelKind.FULL_REFRESH),
                model("D", ModelKind.FULL_REFRESH));
        DependencyGraph dag = DependencyGraph.create()
                .addEdge("A", "B")
                .addEdge("B", "C")
                .addNode("D");

        Plan plan = planner.generatePlan(request(models, modified("A"), dag).build());

        assertThat(plan.getSummary().getModelsChanged()).containsExactly("A", "B", "C");
        Map<String, PlanStep> steps = byModel(plan);
        assertThat(steps).doesNotContainKey("D");
        assertThat(steps.get("A").getParallelGroup()).isEqualTo(0);
        assertThat(steps.get("B").getParallelGroup()).isEqualTo(1);
        assertThat(steps.get("C").getParallelGroup()).isEqualTo(2);

        assertThat(steps.get("A").getReason()).isEqualTo("SQL logic changed");
        assertThat(steps.get("B").getReason()).isEqualTo("downstream of A");
        assertThat(steps.get("C").getReason()).isEqualTo("downstream of A");

        assertThat(steps.get("A").getDependsOn()).isEmpty();
        assertThat(steps.get("B").getDependsOn()).containsExactly(steps.get("A").getStepId());
        assertThat(steps.get("C").getDependsOn()).containsExactly(steps.get("B").getStepId());
    }

    @Test
    void dependenciesAlwaysSitInEarlierGroups_forDiamondGraph() {
        Map<String, ModelDefinition> models = models(
                model("a", ModelKind.FULL_REFRESH),
                model("b", ModelKind.FULL_REFRESH),
                model("c", ModelKind.FULL_REFRESH),
                model("d", ModelKind.FULL_REFRESH));
        DependencyGraph dag = DependencyGraph.create()
                .addEdge("a", "b")
                .addEdge("a", "c")
                .addEdge("b", "d")
                .addEdge("c", "d")
                .addEdge("a", "d");

        Plan plan = planner.generatePlan(request(models, modified("a"), dag).build());

        Map<String, PlanStep> steps = byModel(plan);
        Map<String, PlanStep> byStepId = plan.getSteps().stream()
                .collect(Collectors.toMap(PlanStep::getStepId, Function.identity()));
        for (PlanStep step : plan.getSteps()) {
            for (String dependency : step.getDependsOn()) {
                assertThat(byStepId.get(dependency).getParallelGroup()).isLessThan(step.getParallelGroup());
            }
        }
        assertThat(steps.get("b").getParallelGroup()).isEqualTo(1);
        assertThat(steps.get("c").getParallelGroup()).isEqualTo(1);
        assertThat(steps.get("d").getParallelGroup()).isEqualTo(2);
    }

    @Test
    void fallsBackToSequentialGroups_whenAffectedSubgraphHasCycle() {
        Map<String, ModelDefinition> models = models(
                model("x", ModelKind.FULL_REFRESH),
                model("y", ModelKind.FULL_REFRESH));
        DependencyGraph dag = DependencyGraph.create()
                .addEdge("x", "y")
                .addEdge("y", "x");

        Plan plan = planner.generatePlan(request(models, modified("x", "y"), dag).build());

        Map<String, PlanStep> steps = byModel(plan);
        assertThat(steps.get("x").getParallelGroup()).isEqualTo(0);
        assertThat(steps.get("y").getParallelGroup()).isEqualTo(1);
    }

    @Test
    void modelsOutsideTheDagLandInGroupZero() {
        Map<String, ModelDefinition> models = models(
                model("solo", ModelKind.FULL_REFRESH),
                model("other", ModelKind.FULL_REFRESH));

        Plan plan = planner.generatePlan(request(models, modified("other", "solo"), DependencyGraph.create()).build());

        assertThat(plan.getSteps()).extracting(PlanStep::getParallelGroup).containsOnly(0);
        assertThat(plan.getSteps()).extracting(PlanStep::getModel).containsExactly("other", "solo");
    }

    @Test
    void dropsDescendantsThatAreNotInTheTargetModelSet() {
        Map<String, ModelDefinition> models = models(model("a", ModelKind.FULL_REFRESH));
        DependencyGraph dag = DependencyGraph.create().addEdge("a", "deleted_downstream");

        Plan plan = planner.generatePlan(request(models, modified("a"), dag).build());

        assertThat(plan.getSummary().getModelsChanged()).containsExactly("a");
    }

    // ========================= RUN TYPE & RANGE =========================

    @Test
    void addedModelsAreFullyRefreshed_evenWhenIncremental() {
        Map<String, ModelDefinition> models = models(model("events", ModelKind.INCREMENTAL_BY_TIME_RANGE));
        DiffResult diff = DiffResult.builder().addedModels(List.of("events")).build();

        PlanStep step = planner.generatePlan(request(models, diff, DependencyGraph.create()).build()).getSteps().get(0);

        assertThat(step.getRunType()).isEqualTo(RunType.FULL_REFRESH);
        assertThat(step.getInputRange()).isNull();
        assertThat(step.getReason()).isEqualTo("new model added");
    }

    @Test
    void addedModelIsFullyRefreshed_whenDefinitionNameDiffersFromItsKey() {
        ModelDefinition events = model("analytics.events", ModelKind.INCREMENTAL_BY_TIME_RANGE);
        Map<String, ModelDefinition> models = Map.of("events", events);
        DiffResult diff = DiffResult.builder().addedModels(List.of("events")).build();

        PlanStep step = planner.generatePlan(request(models, diff, DependencyGraph.create()).build()).getSteps().get(0);

        assertThat(step.getModel()).isEqualTo("events");
        assertThat(step.getRunType()).isEqualTo(RunType.FULL_REFRESH);
        assertThat(step.getInputRange()).isNull();
    }

    @Test
    void fullRefreshAndMergeKindsNeverGetARange() {
        Map<String, ModelDefinition> models = models(
                model("dim", ModelKind.FULL_REFRESH),
                model("merged", ModelKind.MERGE_BY_KEY),
                model("legacy", null));

        Plan plan = planner.generatePlan(request(models, modified("dim", "merged", "legacy"), DependencyGraph.create()).build());

        assertThat(plan.getSteps()).allSatisfy(step -> {
            assertThat(step.getRunType()).isEqualTo(RunType.FULL_REFRESH);
            assertThat(step.getInputRange()).isNull();
        });
    }

    @Test
    void incrementalRangeResumesFromWatermarkEnd() {
        Map<String, ModelDefinition> models = models(model("events", ModelKind.INCREMENTAL_BY_TIME_RANGE));
        Map<String, Watermark> watermarks = Map.of(
                "events", Watermark.of(LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 20)));

        PlanStep step = planner.generatePlan(request(models, modified("events"), DependencyGraph.create())
                .watermarks(watermarks)
                .build()).getSteps().get(0);

        assertThat(step.getRunType()).isEqualTo(RunType.INCREMENTAL);
        assertThat(step.getInputRange().getStart()).isEqualTo(LocalDate.of(2024, 5, 20));
        assertThat(step.getInputRange().getEnd()).isEqualTo(AS_OF);
    }

    @Test
    void incrementalRangeLooksBack_whenNoWatermarkExists() {
        Map<String, ModelDefinition> models = models(model("clicks", ModelKind.APPEND_ONLY));
        PlannerConfig config = PlannerConfig.builder().defaultLookbackDays(7).build();

        PlanStep step = planner.generatePlan(request(models, modified("clicks"), DependencyGraph.create())
                .config(config)
                .build()).getSteps().get(0);

        assertThat(step.getInputRange().getStart()).isEqualTo(LocalDate.of(2024, 5, 25));
        assertThat(step.getInputRange().getEnd()).isEqualTo(AS_OF);
    }

    @Test
    void incrementalRangeWidensToEarliestAffectedUpstreamWatermark() {
        Map<String, ModelDefinition> models = models(
                model("upstream", ModelKind.INCREMENTAL_BY_TIME_RANGE),
                model("downstream", ModelKind.INCREMENTAL_BY_TIME_RANGE));
        DependencyGraph dag = DependencyGraph.create().addEdge("upstream", "downstream");
        Map<String, Watermark> watermarks = Map.of(
                "upstream", Watermark.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 5, 31)),
                "downstream", Watermark.of(LocalDate.of(2024, 5, 10), LocalDate.of(2024, 5, 25)));

        Map<String, PlanStep> steps = byModel(planner.generatePlan(request(models, modified("upstream"), dag)
                .watermarks(watermarks)
                .build()));

        assertThat(steps.get("upstream").getInputRange().getStart()).isEqualTo(LocalDate.of(2024, 5, 31));
        assertThat(steps.get("downstream").getInputRange().getStart()).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(steps.get("downstream").getInputRange().getEnd()).isEqualTo(AS_OF);
    }

    @Test
    void clampsStartToEnd_whenWatermarkIsAheadOfAsOfDate() {
        Map<String, ModelDefinition> models = models(model("events", ModelKind.INCREMENTAL_BY_TIME_RANGE));
        Map<String, Watermark> watermarks = Map.of(
                "events", Watermark.of(LocalDate.of(2024, 6, 1), LocalDate.of(2024, 6, 10)));

        PlanStep step = planner.generatePlan(request(models, modified("events"), DependencyGraph.create())
                .watermarks(watermarks)
                .asOfDate(LocalDate.of(2024, 6, 5))
                .build()).getSteps().get(0);

        assertThat(step.getInputRange().getStart()).isEqualTo(LocalDate.of(2024, 6, 5));
        assertThat(step.getInputRange().getEnd()).isEqualTo(LocalDate.of(2024, 6, 5));
    }

    // ========================= COST =========================

    @Test
    void estimatesCostFromRunHistoryOrDefault() {
        Map<String, ModelDefinition> models = models(
                model("fast", ModelKind.FULL_REFRESH),
                model("unknown", ModelKind.FULL_REFRESH));
        Map<String, RunStatistics> runStats = Map.of("fast", RunStatistics.ofAverage(120.0));

        Plan plan = planner.generatePlan(request(models, modified("fast", "unknown"), DependencyGraph.create())
                .runStats(runStats)
                .build());

        Map<String, PlanStep> steps = byModel(plan);
        assertThat(steps.get("fast").getEstimatedComputeSeconds()).isEqualTo(120.0);
        assertThat(steps.get("fast").getEstimatedCostUsd()).isEqualTo(0.084);
        assertThat(steps.get("unknown").getEstimatedComputeSeconds()).isEqualTo(300.0);
        assertThat(steps.get("unknown").getEstimatedCostUsd()).isEqualTo(0.21);
        assertThat(plan.getSummary().getEstimatedCostUsd()).isEqualTo(0.294);
    }

    // ========================= COSMETIC CHANGES =========================

    @Test
    void skipsCosmeticOnlyChanges_andTheirDownstream() {
        ModelDefinition a = model("A", ModelKind.FULL_REFRESH);
        a.setCleanSql("SELECT id FROM src");
        Map<String, ModelDefinition> models = models(a, model("B", ModelKind.FULL_REFRESH));
        DependencyGraph dag = DependencyGraph.create().addEdge("A", "B");
        when(sqlToolkit.classifyChange("select id\nfrom src", "SELECT id FROM src"))
                .thenReturn(CosmeticCheck.COSMETIC_ONLY);

        Plan plan = planner.generatePlan(request(models, modified("A"), dag)
                .baseSql(Map.of("A", "select id\nfrom src"))
                .build());

        assertThat(plan.getSteps()).isEmpty();
        assertThat(plan.getSummary().getCosmeticChangesSkipped()).containsExactly("A");
        assertThat(plan.getSummary().getTotalSteps()).isZero();
    }

    @Test
    void keepsModel_whenSqlCannotBeClassified(CapturedOutput output) {
        ModelDefinition a = model("A", ModelKind.FULL_REFRESH);
        a.setCleanSql("SELECT (");
        when(sqlToolkit.classifyChange("SELECT 1", "SELECT (")).thenReturn(CosmeticCheck.UNPARSEABLE);

        Plan plan = planner.generatePlan(request(models(a), modified("A"), DependencyGraph.create())
                .baseSql(Map.of("A", "SELECT 1"))
                .build());

        assertThat(plan.getSummary().getModelsChanged()).containsExactly("A");
        assertThat(plan.getSummary().getCosmeticChangesSkipped()).isEmpty();
        assertThat(output).contains("WARN").contains("Could not classify change to A");
    }

    @Test
    void cosmeticallyChangedModelIsStillPlanned_whenDownstreamOfARealChange() {
        ModelDefinition upstream = model("upstream", ModelKind.FULL_REFRESH);
        ModelDefinition reformatted = model("reformatted", ModelKind.FULL_REFRESH);
        reformatted.setCleanSql("SELECT a FROM upstream");
        Map<String, ModelDefinition> models = models(upstream, reformatted);
        DependencyGraph dag = DependencyGraph.create().addEdge("upstream", "reformatted");
        when(sqlToolkit.classifyChange("select a from upstream", "SELECT a FROM upstream"))
                .thenReturn(CosmeticCheck.COSMETIC_ONLY);

        Plan plan = planner.generatePlan(request(models, modified("reformatted", "upstream"), dag)
                .baseSql(Map.of("reformatted", "select a from upstream"))
                .build());

        assertThat(plan.getSummary().getModelsChanged()).containsExactly("reformatted", "upstream");
        assertThat(plan.getSummary().getCosmeticChangesSkipped()).containsExactly("reformatted");
    }

    @Test
    void doesNotClassifySql_whenCosmeticSkippingIsDisabled() {
        Map<String, ModelDefinition> models = models(model("A", ModelKind.FULL_REFRESH));

        Plan plan = planner.generatePlan(request(models, modified("A"), DependencyGraph.create())
                .config(PlannerConfig.builder().skipCosmeticChanges(false).build())
                .baseSql(Map.of("A", "SELECT 1"))
                .build());

        assertThat(plan.getSteps()).hasSize(1);
        verifyNoInteractions(sqlToolkit);
    }

    // ========================= ENRICHMENT =========================

    @Test
    void embedsContractViolationsAndDiffDetailIntoSteps() {
        Map<String, ModelDefinition> models = models(model("orders", ModelKind.FULL_REFRESH));
        ContractValidationResult contracts = ContractValidationResult.builder()
                .violations(List.of(
                        ContractViolation.builder().modelName("orders").columnName("id")
                                .violationType("COLUMN_REMOVED").severity(ViolationSeverity.BREAKING)
                                .expected("id: INT").actual("(missing)").message("gone").build(),
                        ContractViolation.builder().modelName("orders").columnName("note")
                                .violationType("COLUMN_ADDED").severity(ViolationSeverity.INFO).build(),
                        ContractViolation.builder().modelName("not_planned").columnName("x")
                                .violationType("COLUMN_REMOVED").severity(ViolationSeverity.BREAKING).build()))
                .modelsChecked(2)
                .build();
        Map<String, AstDiffDetail> astDiffs = Map.of("orders", AstDiffDetail.builder()
                .changeType(ChangeType.MODIFIED)
                .addedColumns(List.of("tax"))
                .changedColumns(List.of("amount"))
                .build());

        Plan plan = planner.generatePlan(request(models, modified("orders"), DependencyGraph.create())
                .contractResults(contracts)
                .astDiffs(astDiffs)
                .build());

        PlanStep step = plan.getSteps().get(0);
        assertThat(step.getContractViolations()).hasSize(2);
        assertThat(step.getContractViolations().get(0).getSeverity()).isEqualTo("BREAKING");
        assertThat(step.getContractViolations().get(0).getActual()).isEqualTo("(missing)");
        assertThat(step.getDiffDetail().getChangeType()).isEqualTo("MODIFIED");
        assertThat(step.getDiffDetail().getColumnsAdded()).containsExactly("tax");
        assertThat(step.getDiffDetail().getColumnsModified()).containsExactly("amount");
        assertThat(plan.getSummary().getContractViolationsCount()).isEqualTo(2);
        assertThat(plan.getSummary().getBreakingContractViolations()).isEqualTo(1);
    }

    // ========================= DETERMINISM & VALIDATION =========================

    @Test
    void identicalInputsProduceIdenticalPlans() {
        PlanSerializer serializer = new PlanSerializer();
        DependencyGraph dag = DependencyGraph.create().addEdge("a", "b").addEdge("a", "c");

        Map<String, ModelDefinition> first = new HashMap<>(models(
                model("a", ModelKind.FULL_REFRESH), model("b", ModelKind.APPEND_ONLY), model("c", ModelKind.FULL_REFRESH)));
        Map<String, ModelDefinition> second = new HashMap<>(models(
                model("c", ModelKind.FULL_REFRESH), model("b", ModelKind.APPEND_ONLY), model("a", ModelKind.FULL_REFRESH)));

        Plan one = planner.generatePlan(request(first, modified("a"), dag).base("main").target("feature").build());
        Plan two = planner.generatePlan(request(second, modified("a"), dag).base("main").target("feature").build());

        assertThat(one.getPlanId()).isEqualTo(two.getPlanId()).hasSize(64);
        assertThat(serializer.serialize(one)).isEqualTo(serializer.serialize(two));
    }

    @Test
    void planIdChanges_whenTargetChanges() {
        Map<String, ModelDefinition> models = models(model("a", ModelKind.FULL_REFRESH));

        Plan one = planner.generatePlan(request(models, modified("a"), DependencyGraph.create()).target("t1").build());
        Plan two = planner.generatePlan(request(models, modified("a"), DependencyGraph.create()).target("t2").build());

        assertThat(one.getPlanId()).isNotEqualTo(two.getPlanId());
    }

    @Test
    void rejectsMissingAsOfDate() {
        PlanRequest request = request(models(model("a", ModelKind.FULL_REFRESH)), modified("a"), DependencyGraph.create())
                .asOfDate(null)
                .build();

        assertThatThrownBy(() -> planner.generatePlan(request))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("asOfDate");
    }

    @Test
    void rejectsWatermarkThatEndsBeforeItStarts() {
        PlanRequest request = request(models(model("a", ModelKind.INCREMENTAL_BY_TIME_RANGE)), modified("a"),
                DependencyGraph.create())
                .watermarks(Map.of("a", Watermark.of(LocalDate.of(2024, 5, 2), LocalDate.of(2024, 5, 1))))
                .build();

        assertThatThrownBy(() -> planner.generatePlan(request))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'a'");
    }

    @Test
    void rejectsNegativeAverageRuntime() {
        PlanRequest request = request(models(model("a", ModelKind.FULL_REFRESH)), modified("a"), DependencyGraph.create())
                .runStats(Map.of("a", RunStatistics.ofAverage(-5.0)))
                .build();

        assertThatThrownBy(() -> planner.generatePlan(request))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ========================= HELPERS =========================

    private static ModelDefinition model(String name, ModelKind kind) {
        return ModelDefinition.builder()
                .name(name)
                .kind(kind)
                .rawSql("SELECT 1")
                .build();
    }

    private static Map<String, ModelDefinition> models(ModelDefinition... models) {
        Map<String, ModelDefinition> byName = new HashMap<>();
        for (ModelDefinition model : models) {
            byName.put(model.getName(), model);
        }
        return byName;
    }

    private static DiffResult modified(String... names) {
        return DiffResult.builder().modifiedModels(List.of(names)).build();
    }

    private static PlanRequest.PlanRequestBuilder request(Map<String, ModelDefinition> models, DiffResult diff,
                                                          DependencyGraph dag) {
        return PlanRequest.builder()
                .models(models)
                .diffResult(diff)
                .dag(dag)
                .asOfDate(AS_OF);
    }

    private static Map<String, PlanStep> byModel(Plan plan) {
        return plan.getSteps().stream().collect(Collectors.toMap(PlanStep::getModel, Function.identity()));
    }
}
