package com.eainde.refinement.dispatch;

import com.eainde.refinement.batch.MergedTask;
import com.eainde.refinement.config.RefinementConfigurationException;
import com.eainde.refinement.model.ContextAnchors;
import com.eainde.refinement.model.Document;
import com.eainde.refinement.model.RefinementAction;
import com.eainde.refinement.model.RefinementTask;
import com.eainde.refinement.model.Severity;
import com.eainde.refinement.model.SourceIssue;
import com.eainde.refinement.support.Fixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RepairDispatcherTest {

    @Mock private SurgicalEditStrategy editStrategy;
    @Mock private RegenerationStrategy regenerationStrategy;
    @Mock private SectionVerifier verifier;

    private final Document document = Fixtures.document(3);
    private RepairDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new RepairDispatcher(editStrategy, regenerationStrategy, verifier, Runnable::run);
    }

    private static MergedTask merged(String sectionId, RefinementAction action, SourceIssue... issues) {
        RefinementTask task = new RefinementTask(sectionId, action, Severity.MAJOR, List.of(issues), null);
        return new MergedTask(sectionId, action, Severity.MAJOR, List.of(issues), ContextAnchors.none(), List.of(task));
    }

    // =========================================================================
    //  Strategy selection
    // =========================================================================

    @Nested
    @DisplayName("Strategy selection")
    class StrategySelection {

        @Test
        @DisplayName("SURGICAL_EDIT goes to the edit strategy with section text and instructions")
        void surgicalEdit() {
            SourceIssue issue = Fixtures.issue("vague");
            when(editStrategy.edit(any())).thenReturn(RepairResult.success("patched", 40, 5, "+3 chars"));
            when(verifier.verify(anyList(), anyString())).thenReturn(new VerificationResult(0.9, 1, 0, 10));

            RepairOutcome outcome = dispatcher.dispatch(merged("sec_2", RefinementAction.SURGICAL_EDIT, issue), document);

            ArgumentCaptor<EditRequest> request = ArgumentCaptor.forClass(EditRequest.class);
            verify(editStrategy).edit(request.capture());
            assertThat(request.getValue().sectionId()).isEqualTo("sec_2");
            assertThat(request.getValue().sectionTitle()).isEqualTo("Section 2");
            assertThat(request.getValue().sectionContent()).isEqualTo("original 2");
            assertThat(request.getValue().fixInstructions()).contains("vague");
            verify(regenerationStrategy, never()).regenerate(any());

            assertThat(outcome.success()).isTrue();
            assertThat(outcome.content()).isEqualTo("patched");
            assertThat(outcome.score()).isEqualTo(0.9);
            assertThat(outcome.tokensUsed()).isEqualTo(50);
            assertThat(outcome.diffSummary()).isEqualTo("+3 chars");
        }

        @Test
        @DisplayName("REGENERATE_SECTION goes to the regeneration strategy with the outline")
        void regeneration() {
            when(regenerationStrategy.regenerate(any())).thenReturn(RepairResult.success("rewritten", 100, 5, null));
            when(verifier.verify(anyList(), anyString())).thenReturn(new VerificationResult(0.8, 1, 0, 0));

            RepairOutcome outcome = dispatcher.dispatch(
                    merged("sec_3", RefinementAction.REGENERATE_SECTION, Fixtures.issue("thin")), document);

            ArgumentCaptor<RegenerationRequest> request = ArgumentCaptor.forClass(RegenerationRequest.class);
            verify(regenerationStrategy).regenerate(request.capture());
            assertThat(request.getValue().sectionSpec().sectionId()).isEqualTo("sec_3");
            assertThat(request.getValue().sectionSpec().currentContent()).isEqualTo("original 3");
            assertThat(request.getValue().lessonOutline()).containsExactly("Section 1", "Section 2", "Section 3");
            verify(editStrategy, never()).edit(any());
            assertThat(outcome.content()).isEqualTo("rewritten");
        }

        @Test
        @DisplayName("a table missing an action is rejected at construction")
        void incompleteTable() {
            Map<RefinementAction, RepairStrategy> table = new EnumMap<>(RefinementAction.class);
            table.put(RefinementAction.SURGICAL_EDIT, new SurgicalEditAdapter(editStrategy));

            assertThatThrownBy(() -> new RepairDispatcher(table, verifier, Runnable::run))
                    .isInstanceOf(RefinementConfigurationException.class)
                    .hasMessageContaining("REGENERATE_SECTION");
        }
    }

    // =========================================================================
    //  Failures
    // =========================================================================

    @Nested
    @DisplayName("Failures become failed outcomes")
    class Failures {

        @Test
        @DisplayName("a throwing strategy costs no tokens and keeps the prior content")
        void strategyThrows() {
            when(editStrategy.edit(any())).thenThrow(new IllegalStateException("model down"));

            RepairOutcome outcome = dispatcher.dispatch(
                    merged("sec_1", RefinementAction.SURGICAL_EDIT, Fixtures.issue("x")), document);

            assertThat(outcome.success()).isFalse();
            assertThat(outcome.content()).isEqualTo("original 1");
            assertThat(outcome.tokensUsed()).isZero();
            assertThat(outcome.hasScore()).isFalse();
            assertThat(outcome.errorMessage()).contains("model down");
            verify(verifier, never()).verify(anyList(), anyString());
        }

        @Test
        @DisplayName("a reported failure keeps its tokens")
        void reportedFailure() {
            when(editStrategy.edit(any())).thenReturn(RepairResult.failure("original 1", 30, "refused"));

            RepairOutcome outcome = dispatcher.dispatch(
                    merged("sec_1", RefinementAction.SURGICAL_EDIT, Fixtures.issue("x")), document);

            assertThat(outcome.success()).isFalse();
            assertThat(outcome.tokensUsed()).isEqualTo(30);
            assertThat(outcome.errorMessage()).isEqualTo("refused");
        }

        @Test
        @DisplayName("blank content counts as a failure")
        void blankContent() {
            when(editStrategy.edit(any())).thenReturn(RepairResult.success("  ", 12, 1, null));

            RepairOutcome outcome = dispatcher.dispatch(
                    merged("sec_1", RefinementAction.SURGICAL_EDIT, Fixtures.issue("x")), document);

            assertThat(outcome.success()).isFalse();
            assertThat(outcome.content()).isEqualTo("original 1");
            assertThat(outcome.tokensUsed()).isEqualTo(12);
        }

        @Test
        @DisplayName("a throwing verifier discards the repair but keeps the strategy tokens")
        void verifierThrows() {
            when(editStrategy.edit(any())).thenReturn(RepairResult.success("patched", 25, 1, null));
            when(verifier.verify(anyList(), anyString())).thenThrow(new RuntimeException("timeout"));

            RepairOutcome outcome = dispatcher.dispatch(
                    merged("sec_1", RefinementAction.SURGICAL_EDIT, Fixtures.issue("x")), document);

            assertThat(outcome.success()).isFalse();
            assertThat(outcome.content()).isEqualTo("original 1");
            assertThat(outcome.tokensUsed()).isEqualTo(25);
        }

        @Test
        @DisplayName("a score outside [0, 1] is a failed verification")
        void invalidScore() {
            when(editStrategy.edit(any())).thenReturn(RepairResult.success("patched", 25, 1, null));
            when(verifier.verify(anyList(), anyString())).thenReturn(new VerificationResult(1.5, 1, 0, 5));

            RepairOutcome outcome = dispatcher.dispatch(
                    merged("sec_1", RefinementAction.SURGICAL_EDIT, Fixtures.issue("x")), document);

            assertThat(outcome.success()).isFalse();
            assertThat(outcome.hasScore()).isFalse();
            assertThat(outcome.tokensUsed()).isEqualTo(30);
        }
    }

    // =========================================================================
    //  Batch
    // =========================================================================

    @Nested
    @DisplayName("Batch execution")
    class Batch {

        private ExecutorService pool;

        @AfterEach
        void tearDown() {
            if (pool != null) pool.shutdownNow();
        }

        @Test
        @DisplayName("should run tasks concurrently and return outcomes in batch order")
        void concurrentInOrder() throws Exception {
            pool = Executors.newFixedThreadPool(3);
            CountDownLatch allStarted = new CountDownLatch(3);
            SurgicalEditStrategy blocking = request -> {
                allStarted.countDown();
                try {
                    // Only completes if all three run at the same time
                    if (!allStarted.await(5, TimeUnit.SECONDS)) {
                        return RepairResult.failure(request.sectionContent(), 0, "not concurrent");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return RepairResult.success("patched " + request.sectionId(), 10, 1, null);
            };
            RepairDispatcher concurrent = new RepairDispatcher(blocking, regenerationStrategy,
                    (issues, content) -> new VerificationResult(0.9, 1, 0, 0), pool);

            List<RepairOutcome> outcomes = concurrent.dispatchBatch(List.of(
                    merged("sec_3", RefinementAction.SURGICAL_EDIT, Fixtures.issue("a")),
                    merged("sec_1", RefinementAction.SURGICAL_EDIT, Fixtures.issue("b")),
                    merged("sec_2", RefinementAction.SURGICAL_EDIT, Fixtures.issue("c"))), document);

            assertThat(outcomes).extracting(RepairOutcome::sectionId).containsExactly("sec_3", "sec_1", "sec_2");
            assertThat(outcomes).allMatch(RepairOutcome::success);
            assertThat(outcomes.get(1).content()).isEqualTo("patched sec_1");
        }

        @Test
        @DisplayName("one failing task does not affect the others")
        void isolatesFailures() {
            AtomicInteger calls = new AtomicInteger();
            SurgicalEditStrategy flaky = request -> {
                calls.incrementAndGet();
                if (request.sectionId().equals("sec_2")) throw new IllegalStateException("boom");
                return RepairResult.success("ok", 5, 1, null);
            };
            RepairDispatcher mixed = new RepairDispatcher(flaky, regenerationStrategy,
                    (issues, content) -> new VerificationResult(0.7, 0, 1, 0), Runnable::run);

            List<RepairOutcome> outcomes = mixed.dispatchBatch(List.of(
                    merged("sec_1", RefinementAction.SURGICAL_EDIT, Fixtures.issue("a")),
                    merged("sec_2", RefinementAction.SURGICAL_EDIT, Fixtures.issue("b"))), document);

            assertThat(calls).hasValue(2);
            assertThat(outcomes).extracting(RepairOutcome::success).containsExactly(true, false);
        }

        @Test
        @DisplayName("a configuration error inside a worker reaches the caller")
        void configurationErrorPropagates() {
            pool = Executors.newFixedThreadPool(2);
            RepairDispatcher pooled = new RepairDispatcher(editStrategy, regenerationStrategy, verifier, pool);

            assertThatThrownBy(() -> pooled.dispatchBatch(List.of(
                    merged("sec_9", RefinementAction.SURGICAL_EDIT, Fixtures.issue("a"))), document))
                    .isInstanceOf(RefinementConfigurationException.class)
                    .hasMessageContaining("sec_9");
        }
    }
}
