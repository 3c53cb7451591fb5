package com.z254.concord.conductor.health;

import com.z254.concord.conductor.delegation.DelegationService;
import com.z254.concord.conductor.ingestion.EventIngestionService;
import com.z254.concord.conductor.ingestion.ledger.ProcessedEventLedger;
import com.z254.concord.conductor.network.EventNetwork;
import com.z254.concord.conductor.orchestration.ConversationOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;
import reactor.test.StepVerifier;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ConductorHealthIndicator.
 */
@ExtendWith(MockitoExtension.class)
class ConductorHealthIndicatorTest {

    @Mock
    private EventIngestionService ingestionService;

    @Mock
    private ProcessedEventLedger ledger;

    @Mock
    private DelegationService delegationService;

    @Mock
    private ConversationOrchestrator orchestrator;

    @Mock
    private EventNetwork network;

    private ConductorHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        indicator = new ConductorHealthIndicator(ingestionService, ledger, delegationService, orchestrator, network);
        when(network.transport()).thenReturn("memory");
        when(ledger.size()).thenReturn(42);
        when(ledger.pendingCount()).thenReturn(3);
        when(delegationService.openWaits()).thenReturn(1);
        when(orchestrator.runningCount()).thenReturn(1);
    }

    @Test
    void shouldBeUpWhileAccepting() {
        when(ingestionService.isAccepting()).thenReturn(true);
        when(ledger.lastFlushFailure()).thenReturn(Optional.empty());

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("transport", "memory")
                            .containsEntry("ingestion", "ACCEPTING")
                            .containsEntry("ledgerSize", 42)
                            .containsEntry("openDelegationWaits", 1)
                            .doesNotContainKey("lastLedgerFlushFailure");
                })
                .verifyComplete();
    }

    @Test
    void shouldBeDownWhenStoppedAndReportFlushFailure() {
        when(ingestionService.isAccepting()).thenReturn(false);
        when(ledger.lastFlushFailure()).thenReturn(Optional.of("2024-05-14T10:00:00Z disk full"));

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails())
                            .containsEntry("ingestion", "STOPPED")
                            .containsEntry("lastLedgerFlushFailure", "2024-05-14T10:00:00Z disk full");
                })
                .verifyComplete();
    }

    @Test
    void shouldBeDownWhenSubscriptionTerminated() {
        when(ingestionService.isAccepting()).thenReturn(false);
        when(ingestionService.subscriptionFailure())
                .thenReturn(Optional.of("reactor.core.Exceptions$OverflowException: overflow"));
        when(ledger.lastFlushFailure()).thenReturn(Optional.empty());

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails())
                            .containsEntry("ingestion", "FAILED")
                            .containsEntry("ingestionFailure", "reactor.core.Exceptions$OverflowException: overflow");
                })
                .verifyComplete();
    }
}
