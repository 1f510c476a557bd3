package com.eainde.refinement.dispatch;

/**
 * Re-score of one repaired section.
 *
 * @param score           quality score in [0, 1]
 * @param issuesResolved  how many of the original issues the repair fixed
 * @param issuesRemaining how many are still present
 * @param tokensUsed      tokens the verification spent
 */
public record VerificationResult(
        double score,
        int issuesResolved,
        int issuesRemaining,
        long tokensUsed
) {

    public boolean hasValidScore() {
        return !Double.isNaN(score) && score >= 0.0 && score <= 1.0;
    }
}
