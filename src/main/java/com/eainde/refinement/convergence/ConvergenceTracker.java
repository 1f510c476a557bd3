package com.eainde.refinement.convergence;

import com.eainde.refinement.IterationRecord;
import com.eainde.refinement.dispatch.RepairOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Watches the score history of a run.
 *
 * <h3>Signals</h3>
 * <ul>
 *   <li><b>Plateau</b>: over the baseline score followed by every iteration's
 *       aggregate, the last two deltas are both smaller than {@code epsilon}.
 *       Needs at least three points. Informs the final status only.</li>
 *   <li><b>Regression</b>: a section verified in the latest iteration scored
 *       strictly lower than in the most recent earlier iteration that verified it.
 *       The orchestrator locks such sections.</li>
 * </ul>
 *
 * Stateless apart from its parameters; safe to call repeatedly with a growing history.
 */
public class ConvergenceTracker {

    private static final Logger log = LoggerFactory.getLogger(ConvergenceTracker.class);

    private final double epsilon;
    private final double baselineScore;

    public ConvergenceTracker(double epsilon, double baselineScore) {
        this.epsilon = epsilon;
        this.baselineScore = baselineScore;
    }

    public ConvergenceSignal update(List<IterationRecord> history) {
        if (history.isEmpty()) {
            return ConvergenceSignal.none();
        }
        boolean plateaued = isPlateau(scoreSeries(history));
        Set<String> regressed = regressedSections(history);
        if (plateaued || !regressed.isEmpty()) {
            log.debug("Convergence after iteration {}: plateaued={}, regressed={}",
                    history.get(history.size() - 1).iteration(), plateaued, regressed);
        }
        return new ConvergenceSignal(plateaued, regressed);
    }

    /**
     * @return baseline score followed by each iteration's aggregate score
     */
    public List<Double> scoreSeries(List<IterationRecord> history) {
        List<Double> series = new ArrayList<>(history.size() + 1);
        series.add(baselineScore);
        history.forEach(r -> series.add(r.aggregateScore()));
        return series;
    }

    // =========================================================================
    //  Internal Helpers
    // =========================================================================

    private boolean isPlateau(List<Double> series) {
        int n = series.size();
        if (n < 3) {
            return false;
        }
        double lastDelta = Math.abs(series.get(n - 1) - series.get(n - 2));
        double previousDelta = Math.abs(series.get(n - 2) - series.get(n - 3));
        return lastDelta < epsilon && previousDelta < epsilon;
    }

    private Set<String> regressedSections(List<IterationRecord> history) {
        Set<String> regressed = new LinkedHashSet<>();
        IterationRecord latest = history.get(history.size() - 1);

        for (RepairOutcome outcome : latest.outcomes()) {
            if (!outcome.hasScore()) continue;
            previousScore(history, outcome.sectionId()).ifPresent(previous -> {
                if (outcome.score() < previous) {
                    regressed.add(outcome.sectionId());
                }
            });
        }
        return regressed;
    }

    private Optional<Double> previousScore(List<IterationRecord> history, String sectionId) {
        for (int i = history.size() - 2; i >= 0; i--) {
            Optional<Double> score = history.get(i).scoreOf(sectionId);
            if (score.isPresent()) {
                return score;
            }
        }
        return Optional.empty();
    }
}
