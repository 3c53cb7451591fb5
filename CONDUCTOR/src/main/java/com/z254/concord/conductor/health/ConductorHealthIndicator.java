package com.z254.concord.conductor.health;

import com.z254.concord.conductor.delegation.DelegationService;
import com.z254.concord.conductor.ingestion.EventIngestionService;
import com.z254.concord.conductor.ingestion.ledger.ProcessedEventLedger;
import com.z254.concord.conductor.network.EventNetwork;
import com.z254.concord.conductor.orchestration.ConversationOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Health indicator for CONDUCTOR.
 * Down while ingestion is not accepting events, including after its subscription ended
 * on its own. A failed ledger flush is reported as a detail only.
 */
@Component
@Slf4j
public class ConductorHealthIndicator implements ReactiveHealthIndicator {

    private final EventIngestionService ingestionService;
    private final ProcessedEventLedger ledger;
    private final DelegationService delegationService;
    private final ConversationOrchestrator orchestrator;
    private final EventNetwork network;

    public ConductorHealthIndicator(
            EventIngestionService ingestionService,
            ProcessedEventLedger ledger,
            DelegationService delegationService,
            ConversationOrchestrator orchestrator,
            EventNetwork network) {
        this.ingestionService = ingestionService;
        this.ledger = ledger;
        this.delegationService = delegationService;
        this.orchestrator = orchestrator;
        this.network = network;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromSupplier(() -> {
                    boolean accepting = ingestionService.isAccepting();
                    Optional<String> subscriptionFailure = ingestionService.subscriptionFailure();
                    Health.Builder builder = accepting && subscriptionFailure.isEmpty() ? Health.up() : Health.down();

                    builder.withDetail("transport", network.transport());
                    builder.withDetail("ingestion", subscriptionFailure.isPresent() ? "FAILED"
                            : accepting ? "ACCEPTING" : "STOPPED");
                    subscriptionFailure.ifPresent(failure -> builder.withDetail("ingestionFailure", failure));
                    builder.withDetail("ledgerSize", ledger.size());
                    builder.withDetail("ledgerPending", ledger.pendingCount());
                    builder.withDetail("openDelegationWaits", delegationService.openWaits());
                    builder.withDetail("runningRoutingLoops", orchestrator.runningCount());

                    Optional<String> flushFailure = ledger.lastFlushFailure();
                    flushFailure.ifPresent(failure -> builder.withDetail("lastLedgerFlushFailure", failure));
                    return builder.build();
                })
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }
}
