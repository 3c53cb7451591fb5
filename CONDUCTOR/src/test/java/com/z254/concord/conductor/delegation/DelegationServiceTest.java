package com.z254.concord.conductor.delegation;

import com.z254.concord.conductor.ConductorTestFixtures;
import com.z254.concord.conductor.conversation.CompletionMode;
import com.z254.concord.conductor.conversation.CompletionOutcome;
import com.z254.concord.conductor.domain.model.Completion;
import com.z254.concord.conductor.domain.model.Conversation;
import com.z254.concord.conductor.exception.ConcurrencyConflictException;
import com.z254.concord.conductor.exception.OrphanedCompletionException;
import com.z254.concord.conductor.exception.TransportException;
import com.z254.concord.conductor.exception.ValidationException;
import com.z254.concord.conductor.network.EventFilter;
import com.z254.concord.conductor.network.EventKind;
import com.z254.concord.conductor.network.EventNetwork;
import com.z254.concord.conductor.network.EventPublisher;
import com.z254.concord.conductor.network.EventTags;
import com.z254.concord.conductor.network.NetworkEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("DelegationService")
class DelegationServiceTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private ConductorTestFixtures.Harness harness;
    private DelegationService delegationService;
    private String conversationId;
    private List<NetworkEvent> published;

    @BeforeEach
    void setUp() {
        harness = new ConductorTestFixtures.Harness();
        delegationService = harness.delegationService;
        conversationId = harness.conversation("Add rate limiting to the public API").getId();

        published = new CopyOnWriteArrayList<>();
        harness.network.subscribe(List.of(EventFilter.builder().kind(EventKind.GENERIC_REPLY.getCode()).build()),
                "observer").subscribe(published::add);
    }

    private static DelegationRequest request(String... recipients) {
        return DelegationRequest.builder()
                .initiator("orchestrator")
                .recipients(List.of(recipients))
                .payload("Please look at the limiter")
                .reason("split the work")
                .build();
    }

    private CompletionOutcome reply(String agent, String content) {
        Completion completion = Completion.builder().agent(agent).content(content).timestamp(Instant.now()).build();
        return delegationService.recordCompletion(conversationId, null, completion, CompletionMode.STRICT).block();
    }

    private Conversation current() {
        return harness.store.find(conversationId).block();
    }

    @Nested
    @DisplayName("Waiting for replies")
    class Waiting {

        @Test
        @DisplayName("completes with every reply once all recipients answered")
        void completesOnCoverage() {
            StepVerifier.create(delegationService.delegate(conversationId, request("a", "b")))
                    .then(() -> {
                        assertThat(delegationService.isWaiting(conversationId)).isTrue();
                        assertThat(reply("a", "limiter added")).isEqualTo(CompletionOutcome.RECORDED);
                        assertThat(reply("b", "tests pass")).isEqualTo(CompletionOutcome.TURN_COMPLETED);
                    })
                    .assertNext(result -> {
                        assertThat(result.isComplete()).isTrue();
                        assertThat(result.getCompletions()).extracting(Completion::getContent)
                                .containsExactly("limiter added", "tests pass");
                        assertThat(result.getMissingAgents()).isEmpty();
                    })
                    .verifyComplete();

            assertThat(delegationService.isWaiting(conversationId)).isFalse();
            assertThat(current().hasOpenTurn()).isFalse();
        }

        @Test
        @DisplayName("publishes one tagged request per recipient")
        void publishesRequests() {
            // When
            Disposable wait = delegationService.delegate(conversationId, request("a", "b")).subscribe();

            // Then
            String turnId = current().getCurrentTurn().getTurnId();
            assertThat(published).hasSize(2);
            assertThat(published).extracting(event -> event.tagValue(EventTags.RECIPIENT).orElseThrow())
                    .containsExactly(harness.identities.a.publicKeyHex(), harness.identities.b.publicKeyHex());
            assertThat(published).allSatisfy(event -> {
                assertThat(event.getPubkey()).isEqualTo(harness.identities.orchestrator.publicKeyHex());
                assertThat(event.tagValue(EventTags.CONVERSATION)).contains(conversationId);
                assertThat(event.tagValue(EventTags.TURN)).contains(turnId);
                assertThat(event.tagValue(EventTags.PHASE)).contains("CHAT");
                assertThat(event.getContent()).isEqualTo("Please look at the limiter");
                assertThat(harness.signer.verify(event)).isTrue();
            });
            wait.dispose();
        }

        @Test
        @DisplayName("completes with the partial set when the turn is closed by force")
        void partialOnForcedClose() {
            StepVerifier.create(delegationService.delegate(conversationId, request("a", "b")))
                    .then(() -> {
                        reply("a", "limiter added");
                        harness.phaseStateMachine.forceCloseTurn(conversationId, "no reply within PT10M").block();
                    })
                    .assertNext(result -> {
                        assertThat(result.isComplete()).isFalse();
                        assertThat(result.getCompletions()).hasSize(1);
                        assertThat(result.getMissingAgents()).containsExactly("b");
                        assertThat(result.getCloseReason()).isEqualTo("no reply within PT10M");
                    })
                    .verifyComplete();

            assertThat(harness.meterRegistry.counter("concord.delegations.partial").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("disposing the subscription drops the wait but keeps the turn open")
        void disposeKeepsTurn() {
            Disposable wait = delegationService.delegate(conversationId, request("a")).subscribe();

            wait.dispose();

            assertThat(delegationService.isWaiting(conversationId)).isFalse();
            assertThat(current().hasOpenTurn()).isTrue();
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("a reply arriving after cancel is orphaned and the turn stays closed")
        void lateReplyAfterCancel() {
            // Given / When
            StepVerifier.create(delegationService.delegate(conversationId, request("a", "b")))
                    .then(() -> {
                        reply("a", "limiter added");
                        delegationService.cancel(conversationId, "user changed their mind").block();
                    })
                    .expectError(CancellationException.class)
                    .verify(WAIT);

            // Then
            Completion late = Completion.builder().agent("b").content("tests pass").timestamp(Instant.now()).build();
            StepVerifier.create(delegationService.recordCompletion(conversationId, null, late, CompletionMode.STRICT))
                    .expectError(OrphanedCompletionException.class)
                    .verify();

            Conversation conversation = current();
            assertThat(conversation.hasOpenTurn()).isFalse();
            assertThat(conversation.getTurnLog()).singleElement().satisfies(turn -> {
                assertThat(turn.isForceClosed()).isTrue();
                assertThat(turn.getCloseReason()).isEqualTo("cancelled: user changed their mind");
                assertThat(turn.getCompletions()).extracting(Completion::getAgent).containsExactly("a");
            });
            assertThat(harness.meterRegistry.counter("concord.completions.orphaned").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("without a wait only closes the open turn")
        void cancelWithoutWait() {
            harness.store.openTurn(conversationId, List.of("a"), "manual", "operator").block();

            StepVerifier.create(delegationService.cancel(conversationId, "operator"))
                    .assertNext(turn -> assertThat(turn.getCloseReason()).isEqualTo("cancelled: operator"))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Rejected delegations")
    class Rejected {

        @Test
        @DisplayName("unknown recipients open no turn")
        void unknownRecipient() {
            StepVerifier.create(delegationService.delegate(conversationId, request("a", "ghost")))
                    .expectErrorSatisfies(error -> assertThat(error)
                            .isInstanceOf(ValidationException.class)
                            .hasMessageContaining("ghost"))
                    .verify();

            assertThat(current().hasOpenTurn()).isFalse();
            assertThat(published).isEmpty();
        }

        @Test
        @DisplayName("the orchestrator cannot be a recipient")
        void orchestratorRecipient() {
            StepVerifier.create(delegationService.delegate(conversationId, request("orchestrator")))
                    .expectError(ValidationException.class)
                    .verify();
        }

        @Test
        @DisplayName("an empty recipient list")
        void noRecipients() {
            StepVerifier.create(delegationService.delegate(conversationId, request()))
                    .expectError(ValidationException.class)
                    .verify();
        }

        @Test
        @DisplayName("a second delegation while a turn is open")
        void secondDelegation() {
            Disposable first = delegationService.delegate(conversationId, request("a")).subscribe();

            StepVerifier.create(delegationService.delegate(conversationId, request("b")))
                    .expectError(ConcurrencyConflictException.class)
                    .verify();

            assertThat(delegationService.isWaiting(conversationId)).isTrue();
            assertThat(current().getCurrentTurn().getAgents()).containsExactly("a");
            first.dispose();
        }
    }

    @Nested
    @DisplayName("Transport failures")
    class TransportFailures {

        @Test
        @DisplayName("fail the delegation and leave the turn open")
        void publishFailure() {
            // Given
            EventNetwork failing = mock(EventNetwork.class);
            when(failing.publish(any())).thenReturn(Mono.error(new IllegalStateException("broker down")));
            when(failing.transport()).thenReturn("kafka");
            EventPublisher publisher = new EventPublisher(failing, harness.signer, harness.identities.orchestrator,
                    harness.properties, harness.meterRegistry);
            DelegationService service = new DelegationService(harness.store, harness.phaseStateMachine, publisher,
                    harness.registry, harness.meterRegistry);

            // When / Then
            StepVerifier.create(service.delegate(conversationId, request("a")))
                    .expectErrorSatisfies(error -> assertThat(error)
                            .isInstanceOf(TransportException.class)
                            .hasMessageContaining("kafka")
                            .hasRootCauseMessage("broker down"))
                    .verify(WAIT);

            assertThat(service.isWaiting(conversationId)).isFalse();
            assertThat(current().hasOpenTurn()).isTrue();
        }
    }
}
