package com.architecture.dataops.modelplan.service.simulation;

import com.architecture.dataops.modelplan.dto.simulation.ChangeAction;
import com.architecture.dataops.modelplan.dto.simulation.ColumnChange;
import com.architecture.dataops.modelplan.dto.simulation.ImpactReport;
import com.architecture.dataops.modelplan.dto.simulation.ModelRemovalReport;
import com.architecture.dataops.modelplan.model.ModelDefinition;
import com.architecture.dataops.modelplan.service.graph.DagBuilder;
import com.architecture.dataops.modelplan.service.sql.SqlToolkit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Entry point for what-if simulations over a set of loaded models.
 * Builds the upstream adjacency and delegates to a fresh {@link ImpactAnalyzer} per call.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SimulationService {

    private final DagBuilder dagBuilder;
    private final SqlToolkit sqlToolkit;

    @Value("${simulation.max-depth:100}")
    private int maxDepth = ImpactAnalyzer.DEFAULT_MAX_DEPTH;

    public ImpactReport simulateColumnChanges(Collection<ModelDefinition> models, String sourceModel,
                                              List<ColumnChange> changes) {
        return analyzerFor(models).simulateColumnChange(sourceModel, changes);
    }

    /**
     * Same as {@link #simulateColumnChanges(Collection, String, List)} for changes given as raw maps
     * with keys {@code action}, {@code column_name}, {@code new_name}, {@code old_type}, {@code new_type}.
     *
     * @throws IllegalArgumentException for an unknown action or a missing column name
     */
    public ImpactReport simulateRawColumnChanges(Collection<ModelDefinition> models, String sourceModel,
                                                 List<Map<String, String>> rawChanges) {
        List<ColumnChange> changes = rawChanges.stream().map(SimulationService::parseChange).toList();
        return simulateColumnChanges(models, sourceModel, changes);
    }

    public ModelRemovalReport simulateModelRemoval(Collection<ModelDefinition> models, String modelName) {
        return analyzerFor(models).simulateModelRemoval(modelName);
    }

    public ImpactReport simulateTypeChange(Collection<ModelDefinition> models, String sourceModel,
                                           String columnName, String oldType, String newType) {
        return analyzerFor(models).simulateTypeChange(sourceModel, columnName, oldType, newType);
    }

    private ImpactAnalyzer analyzerFor(Collection<ModelDefinition> models) {
        Map<String, ModelDefinition> byName = new LinkedHashMap<>();
        for (ModelDefinition model : models) {
            byName.put(model.getName(), model);
        }
        Map<String, List<String>> adjacency = dagBuilder.toAdjacency(models);
        log.debug("Simulating over {} models (max depth {})", byName.size(), maxDepth);
        return new ImpactAnalyzer(byName, adjacency, maxDepth, sqlToolkit);
    }

    static ColumnChange parseChange(Map<String, String> raw) {
        String action = raw.get("action");
        if (action == null) {
            throw new IllegalArgumentException("Column change is missing 'action'");
        }
        ChangeAction changeAction;
        try {
            changeAction = ChangeAction.valueOf(action.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown column change action: " + action, e);
        }
        String columnName = raw.get("column_name");
        if (columnName == null || columnName.isBlank()) {
            throw new IllegalArgumentException("Column change is missing 'column_name'");
        }
        return ColumnChange.builder()
                .action(changeAction)
                .columnName(columnName)
                .newName(raw.get("new_name"))
                .oldType(raw.get("old_type"))
                .newType(raw.get("new_type"))
                .build();
    }
}
