package com.eainde.refinement.model;

import com.eainde.refinement.config.RefinementConfigurationException;
import com.eainde.refinement.support.Fixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RefinementTaskTest {

    @Nested
    @DisplayName("RefinementTask")
    class Task {

        @Test
        @DisplayName("should require at least one source issue")
        void requiresIssues() {
            assertThatThrownBy(() -> new RefinementTask("sec_1", RefinementAction.SURGICAL_EDIT,
                    Severity.MAJOR, List.of(), null))
                    .isInstanceOf(RefinementConfigurationException.class)
                    .hasMessageContaining("no source issues");
        }

        @Test
        @DisplayName("should require an action")
        void requiresAction() {
            assertThatThrownBy(() -> new RefinementTask("sec_1", null, Severity.MAJOR,
                    List.of(Fixtures.issue("x")), null))
                    .isInstanceOf(RefinementConfigurationException.class);
        }

        @Test
        @DisplayName("should default priority to major and anchors to none")
        void defaults() {
            RefinementTask task = new RefinementTask("sec_1", RefinementAction.SURGICAL_EDIT, null,
                    List.of(Fixtures.issue("x")), null);

            assertThat(task.priority()).isEqualTo(Severity.MAJOR);
            assertThat(task.contextAnchors().isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("RefinementPlan")
    class Plan {

        @Test
        @DisplayName("should reject an initial score outside [0, 1]")
        void rejectsScore() {
            assertThatThrownBy(() -> new RefinementPlan(List.of(), OperationMode.FULL_AUTO, 1.2))
                    .isInstanceOf(RefinementConfigurationException.class);
        }

        @Test
        @DisplayName("should list target sections once each, in first-seen order")
        void targetSections() {
            RefinementPlan plan = RefinementPlan.of(OperationMode.FULL_AUTO, List.of(
                    RefinementTask.surgicalEdit("sec_2", Severity.MINOR, Fixtures.issue("a")),
                    RefinementTask.surgicalEdit("sec_1", Severity.MAJOR, Fixtures.issue("b")),
                    RefinementTask.regenerate("sec_2", Severity.CRITICAL, Fixtures.issue("c"))));

            assertThat(plan.targetSections()).containsExactly("sec_2", "sec_1");
        }
    }

    @Nested
    @DisplayName("Wire names")
    class WireNames {

        private final ObjectMapper mapper = new ObjectMapper();

        @Test
        @DisplayName("should read plans with lower-case severity and hyphenated mode")
        void readsPlan() throws Exception {
            String json = """
                    {
                      "operationMode": "semi-auto",
                      "initialScore": 0.6,
                      "tasks": [{
                        "sectionId": "sec_1",
                        "action": "SURGICAL_EDIT",
                        "priority": "critical",
                        "sourceIssues": [{"description": "wrong date", "fixInstructions": "use 1969", "severity": "minor"}]
                      }]
                    }
                    """;

            RefinementPlan plan = mapper.readValue(json, RefinementPlan.class);

            assertThat(plan.operationMode()).isEqualTo(OperationMode.SEMI_AUTO);
            assertThat(plan.initialScore()).isEqualTo(0.6);
            assertThat(plan.tasks().get(0).priority()).isEqualTo(Severity.CRITICAL);
            assertThat(plan.tasks().get(0).sourceIssues().get(0).severity()).isEqualTo(Severity.MINOR);
        }

        @Test
        @DisplayName("mostSevere picks the more urgent severity")
        void mostSevere() {
            assertThat(Severity.mostSevere(Severity.MINOR, Severity.CRITICAL)).isEqualTo(Severity.CRITICAL);
            assertThat(Severity.mostSevere(Severity.MAJOR, Severity.MINOR)).isEqualTo(Severity.MAJOR);
        }
    }
}
