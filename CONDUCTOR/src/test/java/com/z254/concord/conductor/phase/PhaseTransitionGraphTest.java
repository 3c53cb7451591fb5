package com.z254.concord.conductor.phase;

import com.z254.concord.conductor.domain.model.Phase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PhaseTransitionGraph")
class PhaseTransitionGraphTest {

    private PhaseTransitionGraph graph;

    @BeforeEach
    void setUp() {
        graph = new PhaseTransitionGraph();
    }

    @Nested
    @DisplayName("Standard phases")
    class StandardPhases {

        @ParameterizedTest
        @EnumSource(Phase.class)
        @DisplayName("every phase may hand off to itself")
        void selfTransitionAllowed(Phase phase) {
            assertThat(graph.isAllowed(phase.name(), phase.name(), Map.of(), false)).isTrue();
            assertThat(graph.targets(phase)).contains(phase);
        }

        @Test
        @DisplayName("follows the table")
        void followsTable() {
            assertThat(graph.isAllowed("CHAT", "PLAN", Map.of(), false)).isTrue();
            assertThat(graph.isAllowed("PLAN", "EXECUTE", Map.of(), false)).isTrue();
            assertThat(graph.isAllowed("EXECUTE", "VERIFICATION", Map.of(), false)).isTrue();
            assertThat(graph.isAllowed("VERIFICATION", "CHORES", Map.of(), false)).isTrue();
        }

        @Test
        @DisplayName("rejects edges missing from the table")
        void rejectsMissingEdges() {
            assertThat(graph.isAllowed("PLAN", "VERIFICATION", Map.of(), false)).isFalse();
            assertThat(graph.isAllowed("CHAT", "CHORES", Map.of(), false)).isFalse();
            assertThat(graph.isAllowed("BRAINSTORM", "EXECUTE", Map.of(), true)).isFalse();
        }

        @Test
        @DisplayName("lists valid transitions in declaration order")
        void validTransitionsFromChat() {
            assertThat(graph.validTransitions("CHAT", Map.of()))
                    .containsExactly("CHAT", "BRAINSTORM", "PLAN", "EXECUTE", "REFLECTION");
        }
    }

    @Nested
    @DisplayName("Custom phases")
    class CustomPhases {

        @Test
        @DisplayName("entering an unregistered custom phase needs instructions")
        void unregisteredNeedsInstructions() {
            assertThat(graph.isAllowed("CHAT", "SECURITY-REVIEW", Map.of(), false)).isFalse();
            assertThat(graph.isAllowed("CHAT", "SECURITY-REVIEW", Map.of(), true)).isTrue();
        }

        @Test
        @DisplayName("a registered custom phase can be re-entered without instructions")
        void registeredReentered() {
            Map<String, String> registered = Map.of("SECURITY-REVIEW", "Audit the change");

            assertThat(graph.isAllowed("EXECUTE", "SECURITY-REVIEW", registered, false)).isTrue();
        }

        @Test
        @DisplayName("a custom phase may move to any standard phase")
        void customToStandard() {
            Map<String, String> registered = Map.of("SECURITY-REVIEW", "Audit the change");

            assertThat(graph.isAllowed("SECURITY-REVIEW", "CHORES", registered, false)).isTrue();
            assertThat(graph.validTransitions("SECURITY-REVIEW", registered))
                    .contains("CHAT", "CHORES", "REFLECTION", "SECURITY-REVIEW")
                    .doesNotHaveDuplicates();
        }

        @Test
        @DisplayName("registered custom phases are offered from standard phases")
        void registeredOffered() {
            assertThat(graph.validTransitions("PLAN", Map.of("SECURITY-REVIEW", "Audit")))
                    .endsWith("SECURITY-REVIEW");
        }
    }
}
