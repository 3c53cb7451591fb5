package com.z254.concord.conductor.network;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Ed25519 signing identity of a network participant. Keys are exchanged as 32-byte raw
 * values in lowercase hex; the public key hex doubles as the participant's network address.
 */
public final class AgentIdentity {

    static final String ALGORITHM = "Ed25519";

    private static final HexFormat HEX = HexFormat.of();
    private static final byte[] X509_PREFIX = HEX.parseHex("302a300506032b6570032100");
    private static final byte[] PKCS8_PREFIX = HEX.parseHex("302e020100300506032b657004220420");
    private static final int KEY_LENGTH = 32;

    private final PrivateKey privateKey;
    private final PublicKey publicKey;
    private final String publicKeyHex;

    private AgentIdentity(PrivateKey privateKey, PublicKey publicKey) {
        this.privateKey = privateKey;
        this.publicKey = publicKey;
        this.publicKeyHex = HEX.formatHex(rawKey(publicKey.getEncoded()));
    }

    public static AgentIdentity generate() {
        try {
            KeyPair pair = KeyPairGenerator.getInstance(ALGORITHM).generateKeyPair();
            return new AgentIdentity(pair.getPrivate(), pair.getPublic());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 is not available in this JVM", e);
        }
    }

    /**
     * Restore an identity from its raw hex keys.
     *
     * @param privateKeyHex 32-byte private key seed
     * @param publicKeyHex  32-byte public key
     */
    public static AgentIdentity fromHex(String privateKeyHex, String publicKeyHex) {
        try {
            KeyFactory factory = KeyFactory.getInstance(ALGORITHM);
            PrivateKey privateKey = factory.generatePrivate(
                    new PKCS8EncodedKeySpec(concat(PKCS8_PREFIX, parseKey(privateKeyHex))));
            return new AgentIdentity(privateKey, publicKey(publicKeyHex));
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("Invalid Ed25519 key material", e);
        }
    }

    /**
     * Decode a participant's public key from its network address.
     */
    public static PublicKey publicKey(String publicKeyHex) throws GeneralSecurityException {
        return KeyFactory.getInstance(ALGORITHM)
                .generatePublic(new X509EncodedKeySpec(concat(X509_PREFIX, parseKey(publicKeyHex))));
    }

    public String publicKeyHex() {
        return publicKeyHex;
    }

    /**
     * Raw private key seed in hex, for writing the identity to configuration.
     */
    public String privateKeyHex() {
        return HEX.formatHex(rawKey(privateKey.getEncoded()));
    }

    PrivateKey privateKey() {
        return privateKey;
    }

    PublicKey publicKey() {
        return publicKey;
    }

    private static byte[] parseKey(String hex) throws GeneralSecurityException {
        if (hex == null || hex.length() != KEY_LENGTH * 2) {
            throw new GeneralSecurityException("Expected a 64-character hex key");
        }
        try {
            return HEX.parseHex(hex);
        } catch (IllegalArgumentException e) {
            throw new GeneralSecurityException("Key is not valid hex", e);
        }
    }

    private static byte[] rawKey(byte[] encoded) {
        return Arrays.copyOfRange(encoded, encoded.length - KEY_LENGTH, encoded.length);
    }

    private static byte[] concat(byte[] prefix, byte[] key) {
        byte[] result = Arrays.copyOf(prefix, prefix.length + key.length);
        System.arraycopy(key, 0, result, prefix.length, key.length);
        return result;
    }

    @Override
    public String toString() {
        return "AgentIdentity[" + publicKeyHex + "]";
    }
}
