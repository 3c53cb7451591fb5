package com.z254.concord.conductor.conversation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.concord.conductor.domain.model.Completion;
import com.z254.concord.conductor.domain.model.Conversation;
import com.z254.concord.conductor.domain.model.ConversationMessage;
import com.z254.concord.conductor.domain.model.RoutingEntry;
import com.z254.concord.conductor.domain.repository.ConversationRepository;
import com.z254.concord.conductor.exception.ConcurrencyConflictException;
import com.z254.concord.conductor.exception.OrphanedCompletionException;
import com.z254.concord.conductor.exception.ValidationException;
import com.z254.concord.conductor.observability.StructuredLogger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Owner of all conversation state.
 *
 * <p>Every change goes through {@link #mutate}: under a per-conversation lock the mutation is
 * applied to a private copy, and the copy replaces the live state only if the mutation
 * returns normally. A mutation that throws therefore leaves the conversation untouched.
 * The resulting snapshot is then written to the {@link ConversationRepository}. The in-memory
 * state stays authoritative when a write fails; the next mutation writes the full record again.
 *
 * <p>Callers only ever receive copies.
 */
@Component
@Slf4j
public class ConversationStore {

    private final ConversationRepository repository;
    private final ObjectMapper objectMapper;
    private final StructuredLogger structuredLogger;
    private final Map<String, Conversation> conversations = new ConcurrentHashMap<>();
    private final Map<String, Object> locks = new ConcurrentHashMap<>();
    private final List<TurnClosureListener> closureListeners = new CopyOnWriteArrayList<>();
    private final Counter persistenceFailureCounter;

    public ConversationStore(
            ConversationRepository repository,
            ObjectMapper objectMapper,
            StructuredLogger structuredLogger,
            MeterRegistry meterRegistry) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.structuredLogger = structuredLogger;
        this.persistenceFailureCounter = Counter.builder("concord.store.persistence.failures")
                .register(meterRegistry);
    }

    public void onTurnClosed(TurnClosureListener listener) {
        closureListeners.add(listener);
    }

    // ==================== Reads ====================

    public Mono<Conversation> find(String id) {
        return load(id).map(this::copy);
    }

    public Flux<Conversation> findAll() {
        return repository.findAll()
                .map(stored -> conversations.getOrDefault(stored.getId(), stored))
                .map(this::copy);
    }

    // ==================== Writes ====================

    /**
     * Return the conversation, creating it from the factory when it does not exist yet.
     */
    public Mono<Conversation> getOrCreate(String id, Supplier<Conversation> factory) {
        return load(id)
                .switchIfEmpty(Mono.defer(() -> create(id, factory)))
                .map(this::copy);
    }

    /**
     * Apply a mutation atomically.
     *
     * @param id       conversation id
     * @param mutation change applied to a private copy; throwing discards the copy
     * @param <T>      value produced by the mutation
     * @return the mutation's value, empty when it returned null
     */
    public <T> Mono<T> mutate(String id, Function<Conversation, T> mutation) {
        return applyAndPersist(id, mutation)
                .flatMap(applied -> Mono.justOrEmpty(applied.value()));
    }

    /**
     * Apply a change atomically and return the resulting conversation.
     */
    public Mono<Conversation> update(String id, Consumer<Conversation> change) {
        return applyAndPersist(id, conversation -> {
            change.accept(conversation);
            return Boolean.TRUE;
        }).map(applied -> copy(applied.snapshot()));
    }

    public Mono<Conversation> appendMessage(String id, ConversationMessage message) {
        return update(id, conversation -> conversation.appendMessage(message));
    }

    /**
     * Open a routing turn in the current phase.
     *
     * @throws ConcurrencyConflictException (as error signal) when a turn is already open
     */
    public Mono<RoutingEntry> openTurn(String id, List<String> agents, String reason, String initiator) {
        return mutate(id, conversation -> {
            if (conversation.hasOpenTurn()) {
                String openTurnId = conversation.getCurrentTurn().getTurnId();
                throw new ConcurrencyConflictException(
                        "Conversation " + id + " already has open turn " + openTurnId, openTurnId);
            }
            Instant now = Instant.now();
            RoutingEntry turn = RoutingEntry.builder()
                    .turnId(UUID.randomUUID().toString())
                    .createdAt(now)
                    .phase(conversation.getPhase())
                    .agents(List.copyOf(agents))
                    .completions(new ArrayList<>())
                    .reason(reason)
                    .initiator(initiator)
                    .build();
            conversation.openTurn(turn, now);
            int lastIndex = conversation.getHistory().size() - 1;
            for (String agent : agents) {
                var state = conversation.agentState(agent);
                state.setLastSeenPhase(conversation.getPhase());
                state.setLastSeenMessageIndex(lastIndex);
                state.setLastActivityAt(now);
            }
            return turn;
        }).doOnNext(turn -> structuredLogger.logTurnOpened(id, turn));
    }

    /**
     * Record a reply on a turn. A null turn id means the currently open turn.
     *
     * @throws OrphanedCompletionException (as error signal) when the reply matches no open
     *                                     turn target and the mode does not allow recording anyway
     */
    public Mono<CompletionOutcome> recordCompletion(String id, String turnId, Completion completion,
                                                    CompletionMode mode) {
        return mutate(id, conversation -> {
            RoutingEntry current = conversation.getCurrentTurn();
            String effectiveTurnId = turnId != null ? turnId
                    : (current != null ? current.getTurnId() : null);
            boolean matchesOpenTurn = conversation.hasOpenTurn()
                    && current.getTurnId().equals(effectiveTurnId);
            String agent = completion.getAgent();

            if (matchesOpenTurn && current.targets(agent)) {
                if (current.hasReplyFrom(agent)) {
                    return CompletionOutcome.DUPLICATE;
                }
                current.addCompletion(completion);
                appendReply(conversation, completion, effectiveTurnId);
                if (current.coverageReached()) {
                    conversation.closeCurrentTurn("all target agents completed", false, Instant.now());
                    return CompletionOutcome.TURN_COMPLETED;
                }
                return CompletionOutcome.RECORDED;
            }

            Optional<RoutingEntry> turn = conversation.findTurn(effectiveTurnId);
            String detail;
            if (matchesOpenTurn) {
                detail = "agent " + agent + " is not a target of turn " + effectiveTurnId;
            } else if (turn.isPresent()) {
                detail = "turn " + effectiveTurnId + " is already closed";
            } else {
                detail = effectiveTurnId == null ? "no turn is open" : "unknown turn " + effectiveTurnId;
            }

            if (mode == CompletionMode.RECORD_ANYWAY && turn.isPresent()) {
                if (turn.get().hasReplyFrom(agent)) {
                    return CompletionOutcome.DUPLICATE;
                }
                turn.get().addCompletion(completion.toBuilder().forced(true).build());
                appendReply(conversation, completion, effectiveTurnId);
                return CompletionOutcome.RECORDED_FORCED;
            }
            throw new OrphanedCompletionException(id, effectiveTurnId, agent, detail);
        });
    }

    /**
     * Force-close the open turn.
     *
     * @return the closed turn, empty when no turn was open
     */
    public Mono<RoutingEntry> closeTurn(String id, String reason) {
        return mutate(id, conversation -> conversation.hasOpenTurn()
                ? conversation.closeCurrentTurn(reason, true, Instant.now())
                : null);
    }

    // ==================== Internals ====================

    private <T> Mono<Mutation<T>> applyAndPersist(String id, Function<Conversation, T> mutation) {
        return load(id)
                .switchIfEmpty(Mono.error(() -> new ValidationException("Unknown conversation: " + id)))
                .flatMap(ignored -> {
                    Mutation<T> applied = apply(id, mutation);
                    applied.closedTurns().forEach(turn -> notifyClosed(id, turn));
                    return persist(applied.snapshot()).thenReturn(applied);
                });
    }

    private Mono<Conversation> load(String id) {
        Conversation cached = conversations.get(id);
        if (cached != null) {
            return Mono.just(cached);
        }
        return repository.findById(id)
                .map(stored -> {
                    Conversation previous = conversations.putIfAbsent(id, stored);
                    return previous != null ? previous : stored;
                });
    }

    private Mono<Conversation> create(String id, Supplier<Conversation> factory) {
        Conversation created;
        synchronized (lockFor(id)) {
            Conversation existing = conversations.get(id);
            if (existing != null) {
                return Mono.just(existing);
            }
            Instant now = Instant.now();
            created = factory.get();
            created.setId(id);
            created.setCreatedAt(now);
            created.setUpdatedAt(now);
            created.setRevision(1);
            conversations.put(id, created);
        }
        log.info("Created conversation {} ({})", id, created.getTitle());
        return persist(copy(created)).thenReturn(created);
    }

    private <T> Mutation<T> apply(String id, Function<Conversation, T> mutation) {
        synchronized (lockFor(id)) {
            Conversation live = conversations.get(id);
            Conversation working = copy(live);
            T value = mutation.apply(working);
            working.setRevision(live.getRevision() + 1);
            working.setUpdatedAt(Instant.now());
            List<RoutingEntry> closed = closedTurns(live, working);
            conversations.put(id, working);
            return new Mutation<>(value, copy(working), closed);
        }
    }

    private List<RoutingEntry> closedTurns(Conversation before, Conversation after) {
        if (!before.hasOpenTurn()) {
            return List.of();
        }
        String turnId = before.getCurrentTurn().getTurnId();
        if (after.hasOpenTurn() && turnId.equals(after.getCurrentTurn().getTurnId())) {
            return List.of();
        }
        return after.findTurn(turnId)
                .map(turn -> List.of(copy(turn)))
                .orElse(List.of());
    }

    private void notifyClosed(String id, RoutingEntry turn) {
        structuredLogger.logTurnClosed(id, turn);
        for (TurnClosureListener listener : closureListeners) {
            try {
                listener.onTurnClosed(id, turn);
            } catch (RuntimeException e) {
                log.error("Turn closure listener failed for {} turn {}", id, turn.getTurnId(), e);
            }
        }
    }

    private Mono<Conversation> persist(Conversation snapshot) {
        return repository.save(snapshot)
                .onErrorResume(e -> {
                    persistenceFailureCounter.increment();
                    log.error("Failed to persist conversation {} revision {}: {}",
                            snapshot.getId(), snapshot.getRevision(), e.getMessage());
                    return Mono.just(snapshot);
                });
    }

    private void appendReply(Conversation conversation, Completion completion, String turnId) {
        conversation.appendMessage(ConversationMessage.builder()
                .id(completion.getEventId() != null ? completion.getEventId() : UUID.randomUUID().toString())
                .role(ConversationMessage.ROLE_AGENT)
                .author(completion.getAgent())
                .content(completion.getContent())
                .phase(conversation.getPhase())
                .turnId(turnId)
                .timestamp(completion.getTimestamp())
                .build());
        var state = conversation.agentState(completion.getAgent());
        state.setLastActivityAt(completion.getTimestamp());
        state.setLastSeenMessageIndex(conversation.getHistory().size() - 1);
    }

    private Object lockFor(String id) {
        return locks.computeIfAbsent(id, k -> new Object());
    }

    private Conversation copy(Conversation conversation) {
        return objectMapper.convertValue(conversation, Conversation.class);
    }

    private RoutingEntry copy(RoutingEntry turn) {
        return objectMapper.convertValue(turn, RoutingEntry.class);
    }

    private record Mutation<T>(T value, Conversation snapshot, List<RoutingEntry> closedTurns) {
    }
}
