package com.eainde.refinement.dispatch;

import com.eainde.refinement.batch.MergedTask;
import com.eainde.refinement.model.Document;
import com.eainde.refinement.model.Section;

/**
 * Feeds a merged task to a {@link RegenerationStrategy}, with the document
 * outline as surrounding context.
 */
final class RegenerationAdapter implements RepairStrategy {

    private final RegenerationStrategy strategy;

    RegenerationAdapter(RegenerationStrategy strategy) {
        this.strategy = strategy;
    }

    @Override
    public RepairResult repair(MergedTask task, Section section, Document document) {
        SectionSpec spec = new SectionSpec(
                section.id(),
                section.title(),
                section.ordinal(),
                section.content(),
                task.issues());
        return strategy.regenerate(new RegenerationRequest(spec, document.outline(), task.contextAnchors()));
    }
}
