package com.architecture.dataops.modelplan.service.simulation;

import com.architecture.dataops.modelplan.dto.simulation.AffectedModel;
import com.architecture.dataops.modelplan.dto.simulation.ChangeAction;
import com.architecture.dataops.modelplan.dto.simulation.ColumnChange;
import com.architecture.dataops.modelplan.dto.simulation.ImpactReport;
import com.architecture.dataops.modelplan.dto.simulation.ModelRemovalReport;
import com.architecture.dataops.modelplan.dto.simulation.ReferenceSeverity;
import com.architecture.dataops.modelplan.dto.simulation.SimulatedViolation;
import com.architecture.dataops.modelplan.exception.TraversalDepthExceededException;
import com.architecture.dataops.modelplan.model.ColumnContract;
import com.architecture.dataops.modelplan.model.ModelDefinition;
import com.architecture.dataops.modelplan.service.sql.ColumnExtraction;
import com.architecture.dataops.modelplan.service.sql.SqlToolkit;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Read-only what-if analysis over the model dependency graph.
 *
 * Walks downstream of a model breadth-first, visiting children in name order, and
 * reports which models reference the changed columns and which contracts would break.
 * Holds only immutable indexes built at construction, so one instance can serve many calls.
 */
@Slf4j
public class ImpactAnalyzer {

    public static final int DEFAULT_MAX_DEPTH = 100;

    private final Map<String, ModelDefinition> models;
    private final Map<String, List<String>> upstreamByModel;
    private final Map<String, List<String>> childrenByModel;
    private final int maxDepth;
    private final SqlToolkit sqlToolkit;

    /**
     * @param models   every known model keyed by name
     * @param dag      model name to the names of its upstream models
     * @param maxDepth deepest level a walk may reach before it is treated as a cycle
     */
    public ImpactAnalyzer(Map<String, ModelDefinition> models, Map<String, ? extends List<String>> dag,
                          int maxDepth, SqlToolkit sqlToolkit) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1, got " + maxDepth);
        }
        this.models = Map.copyOf(models);
        Map<String, List<String>> upstream = new HashMap<>();
        dag.forEach((name, parents) -> upstream.put(name, List.copyOf(parents)));
        this.upstreamByModel = Collections.unmodifiableMap(upstream);
        this.childrenByModel = buildReverseAdjacency(upstream);
        this.maxDepth = maxDepth;
        this.sqlToolkit = sqlToolkit;
    }

    public ImpactAnalyzer(Map<String, ModelDefinition> models, Map<String, ? extends List<String>> dag,
                          SqlToolkit sqlToolkit) {
        this(models, dag, DEFAULT_MAX_DEPTH, sqlToolkit);
    }

    // ========================= COLUMN CHANGES =========================

    public ImpactReport simulateColumnChange(String sourceModel, List<ColumnChange> changes) {
        List<ColumnChange> columnChanges = new ArrayList<>(changes);
        if (!models.containsKey(sourceModel)) {
            return ImpactReport.builder()
                    .sourceModel(sourceModel)
                    .columnChanges(columnChanges)
                    .summary(notFound(sourceModel))
                    .build();
        }

        Set<String> changedNames = resolveChangedColumns(columnChanges);
        List<AffectedModel> direct = new ArrayList<>();
        List<AffectedModel> transitive = new ArrayList<>();
        List<SimulatedViolation> allViolations = new ArrayList<>();

        walkDownstream(sourceModel, (modelName, depth) -> {
            ModelDefinition model = models.get(modelName);
            if (model == null) {
                return;
            }

            ColumnExtraction extraction = sqlToolkit.extractColumns(model.effectiveSql());
            if (!extraction.isParsed()) {
                log.warn("Column extraction failed for {}: {}", modelName, extraction.getFailureReason());
            }
            List<String> affectedColumns = extraction.getColumns().stream()
                    .filter(changedNames::contains)
                    .sorted()
                    .toList();

            List<SimulatedViolation> violations = checkContracts(modelName, model, columnChanges);
            allViolations.addAll(violations);

            ReferenceSeverity severity = ReferenceSeverity.INFO;
            if (!violations.isEmpty()) {
                severity = violations.stream()
                        .map(SimulatedViolation::getSeverity)
                        .reduce(ReferenceSeverity.INFO, ReferenceSeverity::worse);
            } else if (!affectedColumns.isEmpty()) {
                severity = classifyChangeSeverity(columnChanges);
            }

            AffectedModel affected = AffectedModel.builder()
                    .modelName(modelName)
                    .referenceType(depth == 1 ? AffectedModel.DIRECT : AffectedModel.TRANSITIVE)
                    .columnsAffected(new ArrayList<>(affectedColumns))
                    .contractViolations(violations)
                    .severity(severity)
                    .build();
            (depth == 1 ? direct : transitive).add(affected);
        });

        int breaking = countSeverity(direct, transitive, ReferenceSeverity.BREAKING);
        int warning = countSeverity(direct, transitive, ReferenceSeverity.WARNING);
        String summary = columnSummary(sourceModel, columnChanges, direct, transitive, breaking, warning);

        log.info("Simulated {} column change(s) on {}: {} direct, {} transitive, {} breaking",
                columnChanges.size(), sourceModel, direct.size(), transitive.size(), breaking);

        return ImpactReport.builder()
                .sourceModel(sourceModel)
                .columnChanges(columnChanges)
                .directlyAffected(direct)
                .transitivelyAffected(transitive)
                .contractViolations(allViolations)
                .breakingCount(breaking)
                .warningCount(warning)
                .summary(summary)
                .build();
    }

    public ImpactReport simulateTypeChange(String sourceModel, String columnName, String oldType, String newType) {
        return simulateColumnChange(sourceModel, List.of(ColumnChange.typeChange(columnName, oldType, newType)));
    }

    // ========================= MODEL REMOVAL =========================

    public ModelRemovalReport simulateModelRemoval(String modelName) {
        if (!models.containsKey(modelName)) {
            return ModelRemovalReport.builder()
                    .removedModel(modelName)
                    .summary(notFound(modelName))
                    .build();
        }

        List<AffectedModel> direct = new ArrayList<>();
        List<AffectedModel> transitive = new ArrayList<>();
        Set<String> orphaned = new TreeSet<>();

        walkDownstream(modelName, (current, depth) -> {
            boolean hasOtherUpstream = upstreamByModel.getOrDefault(current, List.of()).stream()
                    .anyMatch(upstream -> !upstream.equals(modelName));
            if (!hasOtherUpstream) {
                orphaned.add(current);
            }
            AffectedModel affected = AffectedModel.builder()
                    .modelName(current)
                    .referenceType(depth == 1 ? AffectedModel.DIRECT : AffectedModel.TRANSITIVE)
                    .severity(ReferenceSeverity.BREAKING)
                    .build();
            (depth == 1 ? direct : transitive).add(affected);
        });

        StringBuilder summary = new StringBuilder(String.format(
                "Removing '%s' would affect %d direct and %d transitive models.",
                modelName, direct.size(), transitive.size()));
        if (!orphaned.isEmpty()) {
            summary.append(String.format(" %d model(s) would be orphaned: %s.",
                    orphaned.size(), String.join(", ", orphaned)));
        }

        log.info("Simulated removal of {}: {} downstream, {} orphaned",
                modelName, direct.size() + transitive.size(), orphaned.size());

        return ModelRemovalReport.builder()
                .removedModel(modelName)
                .directlyAffected(direct)
                .transitivelyAffected(transitive)
                .orphanedModels(new ArrayList<>(orphaned))
                .breakingCount(direct.size() + transitive.size())
                .summary(summary.toString())
                .build();
    }

    // ========================= TRAVERSAL =========================

    @FunctionalInterface
    private interface Visitor {
        void visit(String modelName, int depth);
    }

    /**
     * Breadth-first walk from the children of {@code source}. The source itself is not
     * pre-marked, so a cycle leads back into it and eventually trips the depth limit.
     */
    private void walkDownstream(String source, Visitor visitor) {
        Set<String> visited = new HashSet<>();
        Deque<Map.Entry<String, Integer>> queue = new ArrayDeque<>();
        for (String child : childrenByModel.getOrDefault(source, List.of())) {
            queue.add(Map.entry(child, 1));
        }

        while (!queue.isEmpty()) {
            Map.Entry<String, Integer> next = queue.poll();
            String modelName = next.getKey();
            int depth = next.getValue();
            if (depth > maxDepth) {
                throw new TraversalDepthExceededException(modelName, maxDepth);
            }
            if (!visited.add(modelName)) {
                continue;
            }

            visitor.visit(modelName, depth);

            for (String child : childrenByModel.getOrDefault(modelName, List.of())) {
                if (!visited.contains(child)) {
                    queue.add(Map.entry(child, depth + 1));
                }
            }
        }
    }

    private static Map<String, List<String>> buildReverseAdjacency(Map<String, List<String>> upstreamByModel) {
        Map<String, TreeSet<String>> reverse = new TreeMap<>();
        upstreamByModel.forEach((child, parents) -> {
            reverse.computeIfAbsent(child, k -> new TreeSet<>());
            for (String parent : parents) {
                reverse.computeIfAbsent(parent, k -> new TreeSet<>()).add(child);
            }
        });
        Map<String, List<String>> frozen = new HashMap<>();
        reverse.forEach((parent, children) -> frozen.put(parent, List.copyOf(children)));
        return Collections.unmodifiableMap(frozen);
    }

    // ========================= CLASSIFICATION =========================

    private static Set<String> resolveChangedColumns(List<ColumnChange> changes) {
        Set<String> names = new HashSet<>();
        for (ColumnChange change : changes) {
            names.add(change.getColumnName().toLowerCase(Locale.ROOT));
            if (change.getNewName() != null && !change.getNewName().isEmpty()) {
                names.add(change.getNewName().toLowerCase(Locale.ROOT));
            }
        }
        return names;
    }

    /**
     * Severity for a model that references a changed column but has no contract on it.
     * Decided by the first change that carries a severity.
     */
    private static ReferenceSeverity classifyChangeSeverity(List<ColumnChange> changes) {
        for (ColumnChange change : changes) {
            if (change.getAction() == ChangeAction.REMOVE || change.getAction() == ChangeAction.RENAME) {
                return ReferenceSeverity.BREAKING;
            }
            if (change.getAction() == ChangeAction.TYPE_CHANGE) {
                if (hasText(change.getOldType()) && hasText(change.getNewType())
                        && !TypeCompatibility.isCompatible(change.getOldType(), change.getNewType())) {
                    return ReferenceSeverity.BREAKING;
                }
                return ReferenceSeverity.WARNING;
            }
        }
        return ReferenceSeverity.INFO;
    }

    private static List<SimulatedViolation> checkContracts(String modelName, ModelDefinition model,
                                                           List<ColumnChange> changes) {
        if (!model.hasActiveContract()) {
            return new ArrayList<>();
        }

        Map<String, ColumnContract> contracts = model.getContractColumns().stream()
                .collect(Collectors.toMap(c -> c.getName().toLowerCase(Locale.ROOT), c -> c, (a, b) -> b));

        List<SimulatedViolation> violations = new ArrayList<>();
        for (ColumnChange change : changes) {
            ColumnContract contract = contracts.get(change.getColumnName().toLowerCase(Locale.ROOT));
            if (contract == null) {
                continue;
            }
            String column = change.getColumnName();
            switch (change.getAction()) {
                case REMOVE -> violations.add(breaking(modelName, column, "COLUMN_REMOVED", String.format(
                        "Contract on '%s' requires column '%s' (%s), but it would be removed.",
                        modelName, column, contract.getDataType())));
                case RENAME -> violations.add(breaking(modelName, column, "COLUMN_RENAMED", String.format(
                        "Contract on '%s' requires column '%s', but it would be renamed to '%s'.",
                        modelName, column, change.getNewName())));
                case TYPE_CHANGE -> {
                    if (hasText(change.getNewType())
                            && !TypeCompatibility.isCompatible(contract.getDataType(), change.getNewType())) {
                        violations.add(breaking(modelName, column, "TYPE_CHANGED", String.format(
                                "Contract on '%s' declares '%s' as %s, but it would change to %s.",
                                modelName, column, contract.getDataType(), change.getNewType())));
                    }
                }
                default -> {
                    // adding a column never breaks a contract
                }
            }
        }
        violations.sort(Comparator.comparing(SimulatedViolation::getColumnName));
        return violations;
    }

    private static SimulatedViolation breaking(String modelName, String column, String type, String message) {
        return SimulatedViolation.builder()
                .modelName(modelName)
                .columnName(column)
                .violationType(type)
                .severity(ReferenceSeverity.BREAKING)
                .message(message)
                .build();
    }

    // ========================= SUMMARY =========================

    private static String columnSummary(String sourceModel, List<ColumnChange> changes,
                                        List<AffectedModel> direct, List<AffectedModel> transitive,
                                        int breaking, int warning) {
        String changeDescription = changes.stream()
                .map(c -> c.getAction().name() + " '" + c.getColumnName() + "'")
                .collect(Collectors.joining(", "));
        StringBuilder summary = new StringBuilder(String.format(
                "Simulating %s on '%s': %d direct and %d transitive models affected.",
                changeDescription, sourceModel, direct.size(), transitive.size()));
        if (breaking > 0) {
            summary.append(' ').append(breaking).append(" BREAKING impact(s).");
        }
        if (warning > 0) {
            summary.append(' ').append(warning).append(" WARNING impact(s).");
        }
        if (breaking == 0 && warning == 0 && direct.isEmpty() && transitive.isEmpty()) {
            summary.append(" No downstream impact detected.");
        }
        return summary.toString();
    }

    private static int countSeverity(List<AffectedModel> direct, List<AffectedModel> transitive,
                                     ReferenceSeverity severity) {
        return (int) (direct.stream().filter(a -> a.getSeverity() == severity).count()
                + transitive.stream().filter(a -> a.getSeverity() == severity).count());
    }

    private static String notFound(String modelName) {
        return "Model '" + modelName + "' not found.";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
