package com.eainde.refinement.status;

import com.eainde.refinement.model.Document;
import com.eainde.refinement.model.SourceIssue;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Best iteration of a full-auto run that did not reach its thresholds.
 *
 * @param selectedIteration iteration whose document is returned
 * @param bestScore         aggregate score of that iteration
 * @param qualityStatus     band of {@code bestScore} under the run's mode thresholds
 * @param selectionReason   one-line explanation of the pick, for logs and reviewers
 * @param document          document as of that iteration
 * @param unresolvedIssues  issues still open at the end of the run, most severe first
 * @param improvementHints  up to five short hints for a follow-up pass
 */
public record BestEffortResult(
        int selectedIteration,
        double bestScore,
        QualityStatus qualityStatus,
        String selectionReason,
        @JsonIgnore Document document,
        List<SourceIssue> unresolvedIssues,
        List<String> improvementHints
) {

    public BestEffortResult {
        unresolvedIssues = List.copyOf(unresolvedIssues);
        improvementHints = List.copyOf(improvementHints);
    }
}
