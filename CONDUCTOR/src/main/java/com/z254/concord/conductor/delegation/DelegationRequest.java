package com.z254.concord.conductor.delegation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Work handed to one or more agents as a single routing turn.
 */
@Value
@Builder
public class DelegationRequest {

    /**
     * Slug of the agent delegating the work.
     */
    String initiator;

    @Singular
    List<String> recipients;

    /**
     * Text delivered to every recipient.
     */
    String payload;

    String reason;
}
