package com.z254.concord.conductor.network;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * Subscription filter. Within a filter every populated criterion must match; a subscription
 * with several filters receives events matching any of them.
 */
@Value
@Builder
public class EventFilter {

    @Singular
    Set<String> authors;

    @Singular
    Set<Integer> kinds;

    /**
     * Tag name to accepted values.
     */
    @Singular
    Map<String, Set<String>> tags;

    /**
     * Maximum number of stored events replayed when the subscription opens.
     */
    Integer limit;

    /**
     * Lower bound on {@code created_at}, inclusive.
     */
    Long since;

    public boolean matches(NetworkEvent event) {
        if (!authors.isEmpty() && !authors.contains(event.getPubkey())) {
            return false;
        }
        if (!kinds.isEmpty() && !kinds.contains(event.getKind())) {
            return false;
        }
        if (since != null && event.getCreatedAt() < since) {
            return false;
        }
        for (Map.Entry<String, Set<String>> required : tags.entrySet()) {
            boolean found = event.tagValues(required.getKey()).stream()
                    .anyMatch(required.getValue()::contains);
            if (!found) {
                return false;
            }
        }
        return true;
    }
}
