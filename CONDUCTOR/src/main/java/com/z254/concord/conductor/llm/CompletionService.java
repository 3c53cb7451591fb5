package com.z254.concord.conductor.llm;

import reactor.core.publisher.Mono;

/**
 * Interface for completion backends used by the routing engine.
 */
public interface CompletionService {

    /**
     * Get the unique provider identifier.
     */
    String getProviderId();

    /**
     * Get the default model for this provider.
     */
    String getDefaultModel();

    /**
     * Generate a completion for the given request.
     *
     * @param request the completion request
     * @return the completion response
     */
    Mono<LLMResponse> complete(LLMRequest request);
}
