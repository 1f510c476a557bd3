package com.eainde.refinement.status;

import com.eainde.refinement.IterationRecord;
import com.eainde.refinement.config.ModeThresholds;
import com.eainde.refinement.model.RefinementTask;
import com.eainde.refinement.model.SourceIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Picks the highest-scoring iteration of a run. The first iteration wins ties;
 * the unrefined baseline is never a candidate.
 */
public class BestEffortSelector {

    private static final Logger log = LoggerFactory.getLogger(BestEffortSelector.class);

    static final int MAX_HINTS = 5;

    /**
     * @param history    completed iterations, in order
     * @param unresolved tasks the run could not close
     * @param thresholds thresholds of the run's mode, for the quality band
     * @return empty when no iteration ran
     */
    public Optional<BestEffortResult> select(List<IterationRecord> history,
                                             List<RefinementTask> unresolved,
                                             ModeThresholds thresholds) {
        if (history.isEmpty()) {
            return Optional.empty();
        }

        IterationRecord best = history.get(0);
        for (IterationRecord record : history) {
            if (record.aggregateScore() > best.aggregateScore()) {
                best = record;
            }
        }

        List<SourceIssue> issues = unresolved.stream()
                .flatMap(t -> t.sourceIssues().stream())
                .distinct()
                .sorted(Comparator.comparing(SourceIssue::severity))
                .toList();
        List<String> hints = issues.stream()
                .limit(MAX_HINTS)
                .map(BestEffortSelector::hint)
                .toList();

        QualityStatus quality = QualityStatus.of(best.aggregateScore(), thresholds);
        String reason = String.format(Locale.ROOT, "Iteration %d had highest score (%.2f) among %d attempts",
                best.iteration(), best.aggregateScore(), history.size());

        log.info("Best-effort selection: {}, quality={}, {} unresolved issues",
                reason, quality.wireName(), issues.size());
        return Optional.of(new BestEffortResult(best.iteration(), best.aggregateScore(), quality, reason,
                best.document(), issues, hints));
    }

    private static String hint(SourceIssue issue) {
        String text = "[" + issue.severity().wireName() + "] " + issue.description();
        return issue.fixInstructions().isBlank() ? text : text + ": " + issue.fixInstructions();
    }
}
