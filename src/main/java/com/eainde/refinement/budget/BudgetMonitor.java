package com.eainde.refinement.budget;

import com.eainde.refinement.config.RefinementSettings;

/**
 * Compares cumulative spend against the configured ceilings.
 *
 * The token budget is advisory: exceeding it only raises {@link BudgetStatus#tokenWarning()}.
 * The time budget is hard, but the orchestrator only consults it between iterations,
 * so a batch that is already running always finishes.
 */
public class BudgetMonitor {

    private final long maxTokens;
    private final long timeoutMs;
    private final double nearExhaustionRatio;

    public BudgetMonitor(RefinementSettings settings) {
        this.maxTokens = settings.getMaxTokens();
        this.timeoutMs = settings.getTimeoutMs();
        this.nearExhaustionRatio = RefinementSettings.NEAR_EXHAUSTION_RATIO;
    }

    public BudgetStatus check(long tokensUsed, long elapsedMs) {
        boolean tokenWarning = tokensUsed > maxTokens;
        boolean timeExceeded = elapsedMs >= timeoutMs;
        boolean nearExhaustion = tokenWarning || elapsedMs >= timeoutMs * nearExhaustionRatio;
        return new BudgetStatus(tokenWarning, timeExceeded, nearExhaustion);
    }

    public boolean hasTimeLeft(long elapsedMs) {
        return elapsedMs < timeoutMs;
    }

    public long getMaxTokens() {
        return maxTokens;
    }
}
