package com.eainde.refinement.batch;

import com.eainde.refinement.lock.SectionLockRegistry;
import com.eainde.refinement.model.ContextAnchors;
import com.eainde.refinement.model.Document;
import com.eainde.refinement.model.RefinementAction;
import com.eainde.refinement.model.RefinementTask;
import com.eainde.refinement.model.Severity;
import com.eainde.refinement.model.SourceIssue;
import com.eainde.refinement.support.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TaskBatcherTest {

    private final TaskBatcher batcher = new TaskBatcher();
    private final Document document = Fixtures.document(4);

    private SectionLockRegistry registry(String... sections) {
        return new SectionLockRegistry(List.of(sections), 2);
    }

    @Nested
    @DisplayName("Merging")
    class Merging {

        @Test
        @DisplayName("should collapse tasks on one section into a single merged task")
        void mergesSameSection() {
            SourceIssue first = Fixtures.issue("first");
            SourceIssue second = Fixtures.issue("second");
            List<RefinementTask> tasks = List.of(
                    RefinementTask.surgicalEdit("sec_1", Severity.MINOR, first),
                    RefinementTask.surgicalEdit("sec_1", Severity.MAJOR, second));

            List<MergedTask> batch = batcher.partition(tasks, registry("sec_1"), document);

            assertThat(batch).hasSize(1);
            MergedTask merged = batch.get(0);
            assertThat(merged.issues()).containsExactly(first, second);
            assertThat(merged.priority()).isEqualTo(Severity.MAJOR);
            assertThat(merged.action()).isEqualTo(RefinementAction.SURGICAL_EDIT);
            assertThat(merged.members()).hasSize(2);
        }

        @Test
        @DisplayName("should escalate to regeneration when any member asks for it")
        void regenerationWins() {
            List<RefinementTask> tasks = List.of(
                    RefinementTask.surgicalEdit("sec_2", Severity.MAJOR, Fixtures.issue("a")),
                    RefinementTask.regenerate("sec_2", Severity.MINOR, Fixtures.issue("b")));

            MergedTask merged = batcher.partition(tasks, registry("sec_2"), document).get(0);

            assertThat(merged.action()).isEqualTo(RefinementAction.REGENERATE_SECTION);
        }

        @Test
        @DisplayName("should keep the first non-empty context anchors")
        void firstAnchors() {
            ContextAnchors anchors = new ContextAnchors("before", "after");
            List<RefinementTask> tasks = List.of(
                    RefinementTask.surgicalEdit("sec_1", Severity.MAJOR, Fixtures.issue("a")),
                    new RefinementTask("sec_1", RefinementAction.SURGICAL_EDIT, Severity.MAJOR,
                            List.of(Fixtures.issue("b")), anchors));

            MergedTask merged = batcher.partition(tasks, registry("sec_1"), document).get(0);

            assertThat(merged.contextAnchors()).isEqualTo(anchors);
        }

        @Test
        @DisplayName("combined instructions number every issue")
        void combinedInstructions() {
            SourceIssue quoted = new SourceIssue("typo", "teh", "spell 'the'", Severity.MINOR);
            List<RefinementTask> tasks = List.of(
                    RefinementTask.surgicalEdit("sec_1", Severity.MAJOR, Fixtures.issue("tone", Severity.CRITICAL), quoted));

            String instructions = batcher.partition(tasks, registry("sec_1"), document).get(0).combinedInstructions();

            assertThat(instructions).isEqualTo(
                    "1. [critical] tone -> fix tone\n2. [minor] typo (\"teh\") -> spell 'the'");
        }
    }

    @Nested
    @DisplayName("Filtering and order")
    class FilteringAndOrder {

        @Test
        @DisplayName("should leave out tasks on locked sections")
        void skipsLocked() {
            SectionLockRegistry registry = registry("sec_1", "sec_2");
            registry.lockForRegression("sec_1");
            List<RefinementTask> tasks = List.of(
                    RefinementTask.surgicalEdit("sec_1", Severity.CRITICAL, Fixtures.issue("a")),
                    RefinementTask.surgicalEdit("sec_2", Severity.MINOR, Fixtures.issue("b")));

            List<MergedTask> batch = batcher.partition(tasks, registry, document);

            assertThat(batch).extracting(MergedTask::sectionId).containsExactly("sec_2");
        }

        @Test
        @DisplayName("should order by priority, then by section position")
        void ordering() {
            List<RefinementTask> tasks = List.of(
                    RefinementTask.surgicalEdit("sec_4", Severity.MINOR, Fixtures.issue("a")),
                    RefinementTask.surgicalEdit("sec_3", Severity.MAJOR, Fixtures.issue("b")),
                    RefinementTask.surgicalEdit("sec_2", Severity.CRITICAL, Fixtures.issue("c")),
                    RefinementTask.surgicalEdit("sec_1", Severity.MAJOR, Fixtures.issue("d")));

            List<MergedTask> batch = batcher.partition(tasks, registry("sec_1", "sec_2", "sec_3", "sec_4"), document);

            assertThat(batch).extracting(MergedTask::sectionId)
                    .containsExactly("sec_2", "sec_1", "sec_3", "sec_4");
        }

        @Test
        @DisplayName("should return an empty batch when every section is locked")
        void allLocked() {
            SectionLockRegistry registry = registry("sec_1");
            registry.lockForRegression("sec_1");

            List<MergedTask> batch = batcher.partition(
                    List.of(RefinementTask.surgicalEdit("sec_1", Severity.MAJOR, Fixtures.issue("a"))),
                    registry, document);

            assertThat(batch).isEmpty();
        }
    }
}
