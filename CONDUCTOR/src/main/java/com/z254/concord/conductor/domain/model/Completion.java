package com.z254.concord.conductor.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A reply from one agent to a routing turn. Immutable once recorded.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Completion {

    String agent;
    String content;
    Instant timestamp;

    /**
     * Network event that carried the reply, null when recorded through the inspection API.
     */
    String eventId;

    /**
     * True when recorded with "record anyway" outside the turn's target set or after closure.
     */
    boolean forced;
}
