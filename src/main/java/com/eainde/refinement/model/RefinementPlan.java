package com.eainde.refinement.model;

import com.eainde.refinement.config.RefinementConfigurationException;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Accepted task plan handed over by the evaluator.
 *
 * @param tasks         tasks to execute (may be empty)
 * @param operationMode full-auto or semi-auto
 * @param initialScore  evaluator score of the unrefined document, in [0, 1]
 */
public record RefinementPlan(
        @JsonProperty("tasks")         List<RefinementTask> tasks,
        @JsonProperty("operationMode") OperationMode operationMode,
        @JsonProperty("initialScore")  double initialScore
) {

    public RefinementPlan {
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
        if (operationMode == null) {
            throw new RefinementConfigurationException("Refinement plan has no operation mode");
        }
        if (initialScore < 0.0 || initialScore > 1.0 || Double.isNaN(initialScore)) {
            throw new RefinementConfigurationException("initialScore must be within [0, 1], was " + initialScore);
        }
    }

    public static RefinementPlan of(OperationMode mode, List<RefinementTask> tasks) {
        return new RefinementPlan(tasks, mode, 0.0);
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }

    /**
     * @return ids of every section at least one task targets
     */
    public Set<String> targetSections() {
        return tasks.stream().map(RefinementTask::sectionId).collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
