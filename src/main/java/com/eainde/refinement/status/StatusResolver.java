package com.eainde.refinement.status;

import com.eainde.refinement.config.ModeThresholds;
import com.eainde.refinement.config.RefinementSettings;
import com.eainde.refinement.model.OperationMode;

/**
 * Maps the final score of a run onto a {@link RefinementStatus}.
 *
 * <h3>Decision table</h3>
 * <pre>
 * score &gt;= accept                      -&gt; accepted
 * goodEnough &lt;= score &lt; accept         -&gt; accepted_warning
 *     plateaued and (near exhaustion
 *     or iterations used up)           -&gt; best_effort
 * score &lt; goodEnough, semi-auto,
 *     max_iterations / all_sections_locked -&gt; escalated
 * score &lt; goodEnough, otherwise         -&gt; best_effort
 * </pre>
 */
public class StatusResolver {

    private final RefinementSettings settings;

    public StatusResolver(RefinementSettings settings) {
        this.settings = settings;
    }

    public RefinementStatus resolve(double finalScore,
                                    OperationMode mode,
                                    TerminationReason reason,
                                    boolean plateaued,
                                    boolean nearExhaustion) {
        ModeThresholds thresholds = settings.thresholdsFor(mode);

        if (reason == TerminationReason.NO_TASKS || thresholds.accepts(finalScore)) {
            return RefinementStatus.ACCEPTED;
        }

        if (thresholds.isGoodEnough(finalScore)) {
            boolean outOfRoom = nearExhaustion || reason == TerminationReason.MAX_ITERATIONS;
            return plateaued && outOfRoom ? RefinementStatus.BEST_EFFORT : RefinementStatus.ACCEPTED_WARNING;
        }

        if (mode == OperationMode.SEMI_AUTO
                && (reason == TerminationReason.MAX_ITERATIONS || reason == TerminationReason.ALL_SECTIONS_LOCKED)) {
            return RefinementStatus.ESCALATED;
        }
        return RefinementStatus.BEST_EFFORT;
    }
}
