package com.eainde.refinement.batch;

import com.eainde.refinement.lock.SectionLockRegistry;
import com.eainde.refinement.model.Document;
import com.eainde.refinement.model.RefinementTask;
import com.eainde.refinement.model.Section;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups outstanding refinement tasks into the concurrent batch of one iteration.
 *
 * <h3>Rules:</h3>
 * <ul>
 *   <li>Tasks whose target section is locked are left out of the batch</li>
 *   <li>Tasks for the same section collapse into one {@link MergedTask}
 *       (one repair call, one edit-count increment)</li>
 *   <li>Batch order: priority (critical first), then section position</li>
 * </ul>
 *
 * <pre>
 * TaskBatcher batcher = new TaskBatcher();
 * List&lt;MergedTask&gt; batch = batcher.partition(plan.tasks(), lockRegistry, document);
 * </pre>
 */
public class TaskBatcher {

    private static final Logger log = LoggerFactory.getLogger(TaskBatcher.class);

    // =========================================================================
    //  Partition
    // =========================================================================

    /**
     * @param tasks        every task of the plan
     * @param lockRegistry current lock state
     * @param document     current document, for section ordering
     * @return one merged task per unlocked target section
     */
    public List<MergedTask> partition(List<RefinementTask> tasks,
                                      SectionLockRegistry lockRegistry,
                                      Document document) {
        Map<String, List<RefinementTask>> bySection = new LinkedHashMap<>();
        int skipped = 0;

        for (RefinementTask task : tasks) {
            if (lockRegistry.isLocked(task.sectionId())) {
                skipped++;
                continue;
            }
            bySection.computeIfAbsent(task.sectionId(), k -> new ArrayList<>()).add(task);
        }

        List<MergedTask> batch = new ArrayList<>(bySection.size());
        for (List<RefinementTask> sectionTasks : bySection.values()) {
            batch.add(MergedTask.of(sectionTasks));
        }

        batch.sort(Comparator
                .comparing(MergedTask::priority)
                .thenComparingInt(m -> ordinalOf(document, m.sectionId())));

        if (skipped > 0 || batch.size() < tasks.size()) {
            log.debug("Partitioned {} tasks into {} section dispatches ({} skipped on locked sections)",
                    tasks.size(), batch.size(), skipped);
        }
        return batch;
    }

    // =========================================================================
    //  Internal Helpers
    // =========================================================================

    private int ordinalOf(Document document, String sectionId) {
        return document.section(sectionId).map(Section::ordinal).orElse(Integer.MAX_VALUE);
    }
}
