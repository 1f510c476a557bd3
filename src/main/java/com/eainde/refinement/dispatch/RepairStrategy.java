package com.eainde.refinement.dispatch;

import com.eainde.refinement.batch.MergedTask;
import com.eainde.refinement.model.Document;
import com.eainde.refinement.model.Section;

/**
 * Dispatcher-side view of a repair strategy: one merged task in, one
 * {@link RepairResult} out. One adapter per {@link com.eainde.refinement.model.RefinementAction}.
 */
interface RepairStrategy {

    RepairResult repair(MergedTask task, Section section, Document document);
}
