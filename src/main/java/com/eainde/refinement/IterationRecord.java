package com.eainde.refinement;

import com.eainde.refinement.dispatch.RepairOutcome;
import com.eainde.refinement.model.Document;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Optional;

/**
 * Snapshot of one completed iteration. Appended once to the run history and
 * never modified afterwards.
 *
 * @param iteration      1-based iteration number
 * @param aggregateScore mean of the latest verified score of every target section
 * @param outcomes       per-section outcomes of the iteration's batch
 * @param tokensUsed     tokens spent in this iteration
 * @param durationMs     wall time of the iteration
 * @param document       the document after this iteration's patches were applied
 */
public record IterationRecord(
        int iteration,
        double aggregateScore,
        List<RepairOutcome> outcomes,
        long tokensUsed,
        long durationMs,
        @JsonIgnore Document document
) {

    public IterationRecord {
        outcomes = List.copyOf(outcomes);
    }

    /**
     * @return the verified score this iteration produced for the section, if any
     */
    public Optional<Double> scoreOf(String sectionId) {
        return outcomes.stream()
                .filter(o -> o.sectionId().equals(sectionId) && o.hasScore())
                .map(RepairOutcome::score)
                .findFirst();
    }
}
