package com.eainde.refinement.convergence;

import java.util.Set;

/**
 * @param plateaued         the last two aggregate score deltas were both below epsilon
 * @param regressedSections sections whose latest verified score dropped below their previous one
 */
public record ConvergenceSignal(boolean plateaued, Set<String> regressedSections) {

    public ConvergenceSignal {
        regressedSections = Set.copyOf(regressedSections);
    }

    public static ConvergenceSignal none() {
        return new ConvergenceSignal(false, Set.of());
    }
}
