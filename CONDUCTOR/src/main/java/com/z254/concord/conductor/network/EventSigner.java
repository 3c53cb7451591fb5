package com.z254.concord.conductor.network;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.Signature;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;

/**
 * Computes event ids and Ed25519 signatures.
 *
 * <p>The id is the SHA-256 of {@code [0, pubkey, created_at, kind, tags, content]} serialized
 * as compact JSON; the signature covers the raw id bytes.
 */
@Component
@Slf4j
public class EventSigner {

    private static final HexFormat HEX = HexFormat.of();

    // Dedicated mapper: the canonical form must not follow application-level Jackson settings
    private final ObjectMapper canonicalMapper = new ObjectMapper();

    public NetworkEvent sign(AgentIdentity identity, int kind, List<List<String>> tags,
                             String content, long createdAt) {
        String pubkey = identity.publicKeyHex();
        String id = computeId(pubkey, createdAt, kind, tags, content);
        try {
            Signature signature = Signature.getInstance(AgentIdentity.ALGORITHM);
            signature.initSign(identity.privateKey());
            signature.update(HEX.parseHex(id));
            return NetworkEvent.builder()
                    .id(id)
                    .pubkey(pubkey)
                    .createdAt(createdAt)
                    .kind(kind)
                    .tags(tags)
                    .content(content)
                    .sig(HEX.formatHex(signature.sign()))
                    .build();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign event " + id, e);
        }
    }

    public String computeId(String pubkey, long createdAt, int kind, List<List<String>> tags, String content) {
        try {
            String canonical = canonicalMapper.writeValueAsString(
                    Arrays.asList(0, pubkey, createdAt, kind, tags, content));
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HEX.formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Failed to compute event id", e);
        }
    }

    /**
     * Check that the id matches the content and the signature matches the author key.
     */
    public boolean verify(NetworkEvent event) {
        if (event.getId() == null || event.getSig() == null || event.getPubkey() == null) {
            return false;
        }
        String expectedId = computeId(event.getPubkey(), event.getCreatedAt(), event.getKind(),
                event.getTags(), event.getContent());
        if (!expectedId.equals(event.getId())) {
            log.debug("Event id mismatch: {} != {}", event.getId(), expectedId);
            return false;
        }
        try {
            Signature signature = Signature.getInstance(AgentIdentity.ALGORITHM);
            signature.initVerify(AgentIdentity.publicKey(event.getPubkey()));
            signature.update(HEX.parseHex(event.getId()));
            return signature.verify(HEX.parseHex(event.getSig()));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.debug("Signature check failed for event {}: {}", event.getId(), e.getMessage());
            return false;
        }
    }
}
