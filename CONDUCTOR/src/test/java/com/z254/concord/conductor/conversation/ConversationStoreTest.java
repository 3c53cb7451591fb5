package com.z254.concord.conductor.conversation;

import com.z254.concord.conductor.ConductorTestFixtures;
import com.z254.concord.conductor.domain.model.Completion;
import com.z254.concord.conductor.domain.model.Conversation;
import com.z254.concord.conductor.domain.model.RoutingEntry;
import com.z254.concord.conductor.domain.repository.ConversationRepository;
import com.z254.concord.conductor.exception.ConcurrencyConflictException;
import com.z254.concord.conductor.exception.OrphanedCompletionException;
import com.z254.concord.conductor.exception.ValidationException;
import com.z254.concord.conductor.observability.StructuredLogger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("ConversationStore")
class ConversationStoreTest {

    private ConductorTestFixtures.Harness harness;
    private ConversationStore store;
    private String conversationId;

    @BeforeEach
    void setUp() {
        harness = new ConductorTestFixtures.Harness();
        store = harness.store;
        conversationId = harness.conversation("Investigate the flaky checkout test").getId();
    }

    private static Completion reply(String agent, String content) {
        return Completion.builder()
                .agent(agent)
                .content(content)
                .timestamp(Instant.now())
                .build();
    }

    private Conversation current() {
        return store.find(conversationId).block();
    }

    @Nested
    @DisplayName("Opening turns")
    class OpenTurn {

        @Test
        @DisplayName("records the targets and what they have seen")
        void opensTurn() {
            RoutingEntry turn = store.openTurn(conversationId, List.of("a", "b"), "split the work", "orchestrator")
                    .block();

            Conversation conversation = current();
            assertThat(conversation.getCurrentTurn().getTurnId()).isEqualTo(turn.getTurnId());
            assertThat(turn.getPhase()).isEqualTo("CHAT");
            assertThat(turn.getInitiator()).isEqualTo("orchestrator");
            assertThat(conversation.getAgentStates().get("a").getLastSeenPhase()).isEqualTo("CHAT");
            assertThat(conversation.getAgentStates().get("b").getLastSeenPhase()).isEqualTo("CHAT");
        }

        @Test
        @DisplayName("rejects a second turn while one is open")
        void rejectsSecondTurn() {
            RoutingEntry first = store.openTurn(conversationId, List.of("a"), "first", "orchestrator").block();

            StepVerifier.create(store.openTurn(conversationId, List.of("b"), "second", "orchestrator"))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(ConcurrencyConflictException.class);
                        assertThat(((ConcurrencyConflictException) error).getOpenTurnId())
                                .isEqualTo(first.getTurnId());
                    })
                    .verify();

            assertThat(current().getCurrentTurn().getAgents()).containsExactly("a");
        }

        @Test
        @DisplayName("fails for an unknown conversation")
        void unknownConversation() {
            StepVerifier.create(store.openTurn("missing", List.of("a"), "?", "orchestrator"))
                    .expectError(ValidationException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("Recording completions")
    class RecordCompletion {

        @Test
        @DisplayName("closes the turn once every target has replied")
        void closesOnCoverage() {
            // Given
            store.openTurn(conversationId, List.of("a", "b"), "split the work", "orchestrator").block();

            // When
            CompletionOutcome first = store.recordCompletion(conversationId, null, reply("a", "done with part one"),
                    CompletionMode.STRICT).block();

            // Then
            assertThat(first).isEqualTo(CompletionOutcome.RECORDED);
            assertThat(current().getCurrentTurn().isCompleted()).isFalse();

            // When
            CompletionOutcome second = store.recordCompletion(conversationId, null, reply("b", "done with part two"),
                    CompletionMode.STRICT).block();

            // Then
            assertThat(second).isEqualTo(CompletionOutcome.TURN_COMPLETED);
            Conversation conversation = current();
            assertThat(conversation.hasOpenTurn()).isFalse();
            assertThat(conversation.getTurnLog()).singleElement().satisfies(turn -> {
                assertThat(turn.isCompleted()).isTrue();
                assertThat(turn.isForceClosed()).isFalse();
                assertThat(turn.getCompletions()).extracting(Completion::getAgent).containsExactly("a", "b");
            });
            assertThat(conversation.getHistory()).extracting("author").containsExactly("a", "b");
        }

        @Test
        @DisplayName("ignores a second reply from the same agent")
        void duplicateReply() {
            store.openTurn(conversationId, List.of("a", "b"), "work", "orchestrator").block();
            store.recordCompletion(conversationId, null, reply("a", "first"), CompletionMode.STRICT).block();

            CompletionOutcome outcome = store.recordCompletion(conversationId, null, reply("a", "again"),
                    CompletionMode.STRICT).block();

            assertThat(outcome).isEqualTo(CompletionOutcome.DUPLICATE);
            assertThat(current().getCurrentTurn().getCompletions()).hasSize(1);
        }

        @Test
        @DisplayName("rejects a reply from an agent the turn did not target")
        void rejectsNonTarget() {
            store.openTurn(conversationId, List.of("a"), "work", "orchestrator").block();

            StepVerifier.create(store.recordCompletion(conversationId, null, reply("b", "unsolicited"),
                            CompletionMode.STRICT))
                    .expectErrorSatisfies(error -> assertThat(error)
                            .isInstanceOf(OrphanedCompletionException.class)
                            .hasMessageContaining("not a target"))
                    .verify();
        }

        @Test
        @DisplayName("keeps a non-target reply on request without closing the turn")
        void recordsAnyway() {
            store.openTurn(conversationId, List.of("a"), "work", "orchestrator").block();

            CompletionOutcome outcome = store.recordCompletion(conversationId, null, reply("b", "unsolicited"),
                    CompletionMode.RECORD_ANYWAY).block();

            assertThat(outcome).isEqualTo(CompletionOutcome.RECORDED_FORCED);
            RoutingEntry turn = current().getCurrentTurn();
            assertThat(turn.isCompleted()).isFalse();
            assertThat(turn.getCompletions()).singleElement()
                    .satisfies(completion -> assertThat(completion.isForced()).isTrue());
        }

        @Test
        @DisplayName("never reopens a closed turn")
        void lateReplyOnClosedTurn() {
            // Given
            RoutingEntry turn = store.openTurn(conversationId, List.of("a", "b"), "work", "orchestrator").block();
            store.recordCompletion(conversationId, turn.getTurnId(), reply("a", "part one"), CompletionMode.STRICT).block();
            store.closeTurn(conversationId, "timed out").block();

            // When / Then
            StepVerifier.create(store.recordCompletion(conversationId, turn.getTurnId(), reply("b", "late"),
                            CompletionMode.STRICT))
                    .expectErrorSatisfies(error -> assertThat(error)
                            .isInstanceOf(OrphanedCompletionException.class)
                            .hasMessageContaining("already closed"))
                    .verify();

            CompletionOutcome forced = store.recordCompletion(conversationId, turn.getTurnId(), reply("b", "late"),
                    CompletionMode.RECORD_ANYWAY).block();
            assertThat(forced).isEqualTo(CompletionOutcome.RECORDED_FORCED);

            Conversation conversation = current();
            assertThat(conversation.hasOpenTurn()).isFalse();
            RoutingEntry closed = conversation.getTurnLog().get(0);
            assertThat(closed.isForceClosed()).isTrue();
            assertThat(closed.getCompletions()).hasSize(2);
        }

        @Test
        @DisplayName("orphans a reply when no turn is open")
        void noOpenTurn() {
            StepVerifier.create(store.recordCompletion(conversationId, null, reply("a", "hello"),
                            CompletionMode.RECORD_ANYWAY))
                    .expectError(OrphanedCompletionException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("Closure listeners")
    class Listeners {

        @Test
        @DisplayName("are told once per closed turn")
        void notifiedOnce() {
            List<RoutingEntry> closed = new ArrayList<>();
            store.onTurnClosed((id, turn) -> closed.add(turn));
            store.openTurn(conversationId, List.of("a"), "work", "orchestrator").block();

            store.recordCompletion(conversationId, null, reply("a", "done"), CompletionMode.STRICT).block();
            store.closeTurn(conversationId, "nothing open").block();

            assertThat(closed).singleElement().satisfies(turn -> {
                assertThat(turn.isCompleted()).isTrue();
                assertThat(turn.getCompletions()).hasSize(1);
            });
        }

        @Test
        @DisplayName("a failing listener does not undo the change")
        void failingListener() {
            store.onTurnClosed((id, turn) -> {
                throw new IllegalStateException("listener broke");
            });
            store.openTurn(conversationId, List.of("a"), "work", "orchestrator").block();

            StepVerifier.create(store.closeTurn(conversationId, "operator"))
                    .expectNextCount(1)
                    .verifyComplete();
            assertThat(current().hasOpenTurn()).isFalse();
        }
    }

    @Nested
    @DisplayName("Mutations")
    class Mutations {

        @Test
        @DisplayName("a throwing mutation leaves the conversation untouched")
        void throwingMutation() {
            long revision = current().getRevision();

            StepVerifier.create(store.update(conversationId, conversation -> {
                        conversation.setTitle("changed");
                        throw new ValidationException("refused");
                    }))
                    .expectError(ValidationException.class)
                    .verify();

            Conversation conversation = current();
            assertThat(conversation.getTitle()).isEqualTo("Investigate the flaky checkout test");
            assertThat(conversation.getRevision()).isEqualTo(revision);
        }

        @Test
        @DisplayName("callers only receive copies")
        void returnsCopies() {
            Conversation snapshot = current();
            snapshot.setPhase("EXECUTE");
            snapshot.getHistory().clear();

            assertThat(current().getPhase()).isEqualTo("CHAT");
        }

        @Test
        @DisplayName("every mutation bumps the revision and is written through")
        void revisions() {
            long before = current().getRevision();

            store.update(conversationId, conversation -> conversation.setTitle("renamed")).block();

            Conversation conversation = current();
            assertThat(conversation.getRevision()).isEqualTo(before + 1);
            assertThat(harness.repository.findById(conversationId).block().getTitle()).isEqualTo("renamed");
        }

        @Test
        @DisplayName("a failed write keeps the in-memory state")
        void failedWrite() {
            // Given
            ConversationRepository failing = mock(ConversationRepository.class);
            when(failing.findById(anyString())).thenReturn(Mono.empty());
            when(failing.save(any())).thenReturn(Mono.error(new IllegalStateException("disk full")));
            ConversationStore failingStore = new ConversationStore(failing, harness.objectMapper,
                    new StructuredLogger(harness.objectMapper), new SimpleMeterRegistry());

            // When
            failingStore.getOrCreate("c1", () -> Conversation.builder().title("t").build()).block();
            Conversation updated = failingStore.update("c1", conversation -> conversation.setPhase("PLAN")).block();

            // Then
            assertThat(updated.getPhase()).isEqualTo("PLAN");
            assertThat(failingStore.find("c1").block().getRevision()).isEqualTo(2);
        }
    }
}
