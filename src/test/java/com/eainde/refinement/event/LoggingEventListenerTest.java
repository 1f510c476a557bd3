package com.eainde.refinement.event;

import com.eainde.refinement.lock.LockReason;
import com.eainde.refinement.model.OperationMode;
import com.eainde.refinement.model.RefinementAction;
import com.eainde.refinement.status.RefinementStatus;
import com.eainde.refinement.status.TerminationReason;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class LoggingEventListenerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final LoggingEventListener listener = new LoggingEventListener(mapper);

    private JsonNode json(RefinementEvent event) throws Exception {
        return mapper.readTree(listener.toJson(event));
    }

    @Test
    @DisplayName("events carry their snake_case type discriminator")
    void typeDiscriminator() throws Exception {
        assertThat(json(new RefinementEvent.BatchStarted(1, List.of("sec_1"))).get("type").asText())
                .isEqualTo("batch_started");
        assertThat(json(new RefinementEvent.IterationCompleted(2, 0.8)).get("type").asText())
                .isEqualTo("iteration_complete");
        assertThat(json(new RefinementEvent.BatchCompleted(2)).get("type").asText())
                .isEqualTo("batch_complete");
    }

    @Test
    @DisplayName("enum fields use their wire names")
    void wireNames() throws Exception {
        JsonNode started = json(new RefinementEvent.RefinementStarted(List.of("sec_1"), OperationMode.SEMI_AUTO));
        JsonNode locked = json(new RefinementEvent.SectionLocked("sec_1", LockReason.MAX_EDITS));
        JsonNode completed = json(new RefinementEvent.RefinementCompleted(
                0.7, RefinementStatus.BEST_EFFORT, 3, TerminationReason.MAX_ITERATIONS));

        assertThat(started.get("type").asText()).isEqualTo("refinement_start");
        assertThat(started.get("mode").asText()).isEqualTo("semi-auto");
        assertThat(locked.get("reason").asText()).isEqualTo("max_edits");
        assertThat(completed.get("status").asText()).isEqualTo("best_effort");
        assertThat(completed.get("terminationReason").asText()).isEqualTo("max_iterations");
    }

    @Test
    @DisplayName("a failed verification omits the score")
    void failedVerification() throws Exception {
        JsonNode node = json(new RefinementEvent.VerificationResult(
                "sec_1", RefinementAction.SURGICAL_EDIT, false, null));

        assertThat(node.get("type").asText()).isEqualTo("verification_result");
        assertThat(node.get("passed").asBoolean()).isFalse();
        assertThat(node.has("score")).isFalse();
    }

    @Test
    @DisplayName("logging an event never throws")
    void onEvent() {
        assertThatCode(() -> listener.onEvent(new RefinementEvent.BudgetWarning(16_000, 15_000)))
                .doesNotThrowAnyException();
    }
}
