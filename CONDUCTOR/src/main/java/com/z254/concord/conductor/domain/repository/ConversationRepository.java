package com.z254.concord.conductor.domain.repository;

import com.z254.concord.conductor.domain.model.Conversation;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Repository interface for Conversation persistence.
 *
 * <p>Implementations keep one durable record per conversation and must ignore a save whose
 * {@link Conversation#getRevision() revision} is older than the record already held.
 */
public interface ConversationRepository {

    /**
     * Save a conversation snapshot.
     *
     * @param conversation the conversation to save
     * @return the saved conversation
     */
    Mono<Conversation> save(Conversation conversation);

    /**
     * Find a conversation by ID.
     *
     * @param id the conversation ID
     * @return the conversation or empty
     */
    Mono<Conversation> findById(String id);

    /**
     * Find all conversations.
     *
     * @return every stored conversation
     */
    Flux<Conversation> findAll();

    /**
     * Delete a conversation.
     *
     * @param id the conversation ID
     * @return completion signal
     */
    Mono<Void> deleteById(String id);

    /**
     * Check if a conversation exists.
     *
     * @param id the conversation ID
     * @return true if exists
     */
    Mono<Boolean> existsById(String id);
}
