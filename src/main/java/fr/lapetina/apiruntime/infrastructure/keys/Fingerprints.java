package fr.lapetina.apiruntime.infrastructure.keys;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Short, stable identifiers for key material, safe to log.
 */
final class Fingerprints {

    static final int LENGTH = 12;

    private Fingerprints() {
    }

    /**
     * First 12 lower-case hex characters of the SHA-256 digest of {@code data}.
     */
    static String sha256Prefix(byte[] data) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(data);
            return HexFormat.of().formatHex(digest).substring(0, LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
