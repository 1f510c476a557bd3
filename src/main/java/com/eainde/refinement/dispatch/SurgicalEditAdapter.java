package com.eainde.refinement.dispatch;

import com.eainde.refinement.batch.MergedTask;
import com.eainde.refinement.model.Document;
import com.eainde.refinement.model.Section;

/**
 * Feeds a merged task to a {@link SurgicalEditStrategy}.
 */
final class SurgicalEditAdapter implements RepairStrategy {

    private final SurgicalEditStrategy strategy;

    SurgicalEditAdapter(SurgicalEditStrategy strategy) {
        this.strategy = strategy;
    }

    @Override
    public RepairResult repair(MergedTask task, Section section, Document document) {
        return strategy.edit(new EditRequest(
                section.id(),
                section.title(),
                section.content(),
                task.combinedInstructions(),
                task.contextAnchors()));
    }
}
