package com.z254.concord.conductor.domain.repository.impl;

import com.z254.concord.conductor.domain.model.Conversation;
import com.z254.concord.conductor.domain.repository.ConversationRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link ConversationRepository} implementation for local development.
 */
@Repository
@ConditionalOnProperty(prefix = "concord.store", name = "type", havingValue = "memory")
public class InMemoryConversationRepository implements ConversationRepository {

    private final Map<String, Conversation> store = new ConcurrentHashMap<>();

    @Override
    public Mono<Conversation> save(Conversation conversation) {
        Conversation stored = store.merge(conversation.getId(), conversation,
                (existing, incoming) -> incoming.getRevision() >= existing.getRevision() ? incoming : existing);
        return Mono.just(stored);
    }

    @Override
    public Mono<Conversation> findById(String id) {
        return Mono.justOrEmpty(store.get(id));
    }

    @Override
    public Flux<Conversation> findAll() {
        return Flux.fromIterable(store.values());
    }

    @Override
    public Mono<Void> deleteById(String id) {
        store.remove(id);
        return Mono.empty();
    }

    @Override
    public Mono<Boolean> existsById(String id) {
        return Mono.just(store.containsKey(id));
    }
}
