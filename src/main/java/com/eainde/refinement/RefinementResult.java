package com.eainde.refinement;

import com.eainde.refinement.model.Document;
import com.eainde.refinement.model.RefinementTask;
import com.eainde.refinement.status.BestEffortResult;
import com.eainde.refinement.status.RefinementStatus;
import com.eainde.refinement.status.TerminationReason;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Outcome of one refinement run.
 *
 * @param content           final document (the best iteration's document when a best-effort pick was made)
 * @param status            terminal classification
 * @param iterations        iterations executed
 * @param tokensUsed        total tokens across all repairs and verifications
 * @param durationMs        wall time of the run
 * @param finalScore        aggregate score of the returned document
 * @param terminationReason why the loop stopped
 * @param history           one record per executed iteration
 * @param lockedSections    sections locked at the end of the run
 * @param unresolvedTasks   tasks whose issues the run could not close
 * @param bestEffortResult  best-iteration details when a full-auto run fell back to its best
 *                          iteration (may be null); the status is resolved from that iteration's score
 */
public record RefinementResult(
        Document content,
        RefinementStatus status,
        int iterations,
        long tokensUsed,
        long durationMs,
        double finalScore,
        TerminationReason terminationReason,
        List<IterationRecord> history,
        Set<String> lockedSections,
        List<RefinementTask> unresolvedTasks,
        BestEffortResult bestEffortResult
) {

    public RefinementResult {
        history = List.copyOf(history);
        lockedSections = Set.copyOf(lockedSections);
        unresolvedTasks = List.copyOf(unresolvedTasks);
    }

    public Optional<BestEffortResult> bestEffort() {
        return Optional.ofNullable(bestEffortResult);
    }
}
