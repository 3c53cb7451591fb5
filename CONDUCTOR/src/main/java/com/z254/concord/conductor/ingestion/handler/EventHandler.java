package com.z254.concord.conductor.ingestion.handler;

import com.z254.concord.conductor.ingestion.EventCategory;
import com.z254.concord.conductor.network.NetworkEvent;
import reactor.core.publisher.Mono;

/**
 * Handles accepted events of one category. Each category has exactly one handler.
 */
public interface EventHandler {

    EventCategory category();

    Mono<Void> handle(NetworkEvent event);
}
