package com.eainde.refinement.budget;

/**
 * Budget state at one check point.
 *
 * @param tokenWarning   cumulative tokens exceed the advisory token budget
 * @param timeExceeded   elapsed time reached the hard time budget
 * @param nearExhaustion tokens over budget, or at least 80% of the time budget used
 */
public record BudgetStatus(boolean tokenWarning, boolean timeExceeded, boolean nearExhaustion) {}
