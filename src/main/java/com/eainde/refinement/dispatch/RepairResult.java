package com.eainde.refinement.dispatch;

/**
 * Common result shape of both repair strategies.
 *
 * @param success      whether the strategy produced usable content
 * @param content      patched or regenerated text; the original text on failure
 * @param tokensUsed   tokens the strategy spent
 * @param durationMs   time the strategy spent
 * @param diffSummary  short human-readable description of the change (may be null)
 * @param errorMessage failure reason (null on success)
 */
public record RepairResult(
        boolean success,
        String content,
        long tokensUsed,
        long durationMs,
        String diffSummary,
        String errorMessage
) {

    public static RepairResult success(String content, long tokensUsed, long durationMs, String diffSummary) {
        return new RepairResult(true, content, tokensUsed, durationMs, diffSummary, null);
    }

    public static RepairResult failure(String originalContent, long tokensUsed, String errorMessage) {
        return new RepairResult(false, originalContent, tokensUsed, 0, null, errorMessage);
    }
}
