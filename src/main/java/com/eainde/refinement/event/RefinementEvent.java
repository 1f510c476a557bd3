package com.eainde.refinement.event;

import com.eainde.refinement.lock.LockReason;
import com.eainde.refinement.model.OperationMode;
import com.eainde.refinement.model.RefinementAction;
import com.eainde.refinement.status.RefinementStatus;
import com.eainde.refinement.status.TerminationReason;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

/**
 * Progress events of a refinement run, emitted synchronously on the
 * orchestrator thread. Serialized with a {@code type} discriminator.
 *
 * <h3>Order within one iteration</h3>
 * <pre>
 * batch_started
 *   verification_result   (one per dispatched section)
 *   section_locked        (one per newly locked section)
 * iteration_complete
 * batch_complete
 * budget_warning          (at most once per run)
 * </pre>
 * Framed by exactly one {@code refinement_start} and one {@code refinement_complete};
 * {@code escalation_triggered} precedes the latter on escalated semi-auto runs.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RefinementEvent.RefinementStarted.class, name = "refinement_start"),
        @JsonSubTypes.Type(value = RefinementEvent.BatchStarted.class, name = "batch_started"),
        @JsonSubTypes.Type(value = RefinementEvent.VerificationResult.class, name = "verification_result"),
        @JsonSubTypes.Type(value = RefinementEvent.SectionLocked.class, name = "section_locked"),
        @JsonSubTypes.Type(value = RefinementEvent.IterationCompleted.class, name = "iteration_complete"),
        @JsonSubTypes.Type(value = RefinementEvent.BatchCompleted.class, name = "batch_complete"),
        @JsonSubTypes.Type(value = RefinementEvent.BudgetWarning.class, name = "budget_warning"),
        @JsonSubTypes.Type(value = RefinementEvent.EscalationTriggered.class, name = "escalation_triggered"),
        @JsonSubTypes.Type(value = RefinementEvent.RefinementCompleted.class, name = "refinement_complete")
})
public sealed interface RefinementEvent {

    @JsonTypeName("refinement_start")
    record RefinementStarted(List<String> targetSections, OperationMode mode) implements RefinementEvent {
        public RefinementStarted {
            targetSections = List.copyOf(targetSections);
        }
    }

    @JsonTypeName("batch_started")
    record BatchStarted(int iteration, List<String> sections) implements RefinementEvent {
        public BatchStarted {
            sections = List.copyOf(sections);
        }
    }

    @JsonTypeName("verification_result")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record VerificationResult(String sectionId, RefinementAction action, boolean passed, Double score)
            implements RefinementEvent {}

    @JsonTypeName("section_locked")
    record SectionLocked(String sectionId, LockReason reason) implements RefinementEvent {}

    @JsonTypeName("iteration_complete")
    record IterationCompleted(int iteration, double score) implements RefinementEvent {}

    @JsonTypeName("batch_complete")
    record BatchCompleted(int iteration) implements RefinementEvent {}

    @JsonTypeName("budget_warning")
    record BudgetWarning(long tokensUsed, long maxTokens) implements RefinementEvent {}

    @JsonTypeName("escalation_triggered")
    record EscalationTriggered(TerminationReason reason, double score, double goodEnoughThreshold,
                               int unresolvedIssuesCount) implements RefinementEvent {}

    @JsonTypeName("refinement_complete")
    record RefinementCompleted(double finalScore, RefinementStatus status, int iterations,
                               TerminationReason terminationReason) implements RefinementEvent {}
}
