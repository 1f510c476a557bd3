package com.eainde.refinement.dispatch;

import com.eainde.refinement.model.RefinementAction;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of one merged task within one iteration: the repair plus its verification.
 *
 * @param sectionId       target section
 * @param action          strategy that ran
 * @param success         true only if the repair produced content and the verifier scored it
 * @param content         content to apply on success; the prior content otherwise
 * @param tokensUsed      strategy plus verifier tokens
 * @param durationMs      wall time of repair and verification
 * @param score           verified score, null when the repair or the verification failed
 * @param issuesResolved  issues the verifier considers fixed
 * @param issuesRemaining issues the verifier still sees
 * @param diffSummary     strategy-reported change summary (may be null)
 * @param errorMessage    failure reason (null on success)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RepairOutcome(
        String sectionId,
        RefinementAction action,
        boolean success,
        String content,
        long tokensUsed,
        long durationMs,
        Double score,
        int issuesResolved,
        int issuesRemaining,
        String diffSummary,
        String errorMessage
) {

    public static RepairOutcome failed(String sectionId, RefinementAction action, String priorContent,
                                       long tokensUsed, long durationMs, String errorMessage) {
        return new RepairOutcome(sectionId, action, false, priorContent, tokensUsed, durationMs,
                null, 0, 0, null, errorMessage);
    }

    public boolean hasScore() {
        return score != null;
    }
}
