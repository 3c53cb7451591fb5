package com.z254.concord.conductor.network;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Optional;

/**
 * A signed, timestamped, tagged event on the network.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class NetworkEvent {

    /**
     * Hex SHA-256 of the canonical serialization.
     */
    String id;

    /**
     * Author public key (hex).
     */
    String pubkey;

    /**
     * Creation time in epoch seconds.
     */
    @JsonProperty("created_at")
    long createdAt;

    int kind;

    @Builder.Default
    List<List<String>> tags = List.of();

    String content;

    /**
     * Hex Ed25519 signature over the id.
     */
    String sig;

    /**
     * First value of the named tag.
     */
    public Optional<String> tagValue(String name) {
        return tags.stream()
                .filter(tag -> tag.size() > 1 && name.equals(tag.get(0)))
                .map(tag -> tag.get(1))
                .findFirst();
    }

    public List<String> tagValues(String name) {
        return tags.stream()
                .filter(tag -> tag.size() > 1 && name.equals(tag.get(0)))
                .map(tag -> tag.get(1))
                .toList();
    }

    public Optional<EventKind> knownKind() {
        return EventKind.of(kind);
    }
}
