package com.eainde.refinement.model;

import com.eainde.refinement.config.RefinementConfigurationException;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One unit of targeted repair work against a single section, as accepted by
 * the upstream evaluator. Never mutated by the refinement loop.
 *
 * @param sectionId      target section identifier
 * @param action         surgical edit or full regeneration
 * @param priority       task priority (critical first)
 * @param sourceIssues   issues this task addresses (at least one)
 * @param contextAnchors optional neighbouring excerpts for coherence
 */
public record RefinementTask(
        @JsonProperty("sectionId")      String sectionId,
        @JsonProperty("action")         RefinementAction action,
        @JsonProperty("priority")       Severity priority,
        @JsonProperty("sourceIssues")   List<SourceIssue> sourceIssues,
        @JsonProperty("contextAnchors") ContextAnchors contextAnchors
) {

    public RefinementTask {
        if (sectionId == null || sectionId.isBlank()) {
            throw new RefinementConfigurationException("Refinement task without a target section");
        }
        if (action == null) {
            throw new RefinementConfigurationException("Refinement task for " + sectionId + " has no action");
        }
        if (sourceIssues == null || sourceIssues.isEmpty()) {
            throw new RefinementConfigurationException("Refinement task for " + sectionId + " has no source issues");
        }
        priority = priority != null ? priority : Severity.MAJOR;
        sourceIssues = List.copyOf(sourceIssues);
        contextAnchors = contextAnchors != null ? contextAnchors : ContextAnchors.none();
    }

    public static RefinementTask surgicalEdit(String sectionId, Severity priority, SourceIssue... issues) {
        return new RefinementTask(sectionId, RefinementAction.SURGICAL_EDIT, priority, List.of(issues), null);
    }

    public static RefinementTask regenerate(String sectionId, Severity priority, SourceIssue... issues) {
        return new RefinementTask(sectionId, RefinementAction.REGENERATE_SECTION, priority, List.of(issues), null);
    }
}
