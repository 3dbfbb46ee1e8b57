package fr.lapetina.apiruntime.domain.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Auditable description of resolved key material.
 * Never used for cryptographic operations.
 *
 * @param mode        where the material came from
 * @param algorithm   algorithm family
 * @param fingerprint first 12 hex characters of the SHA-256 of the raw key bytes, may be null
 * @param keyType     "HS256", "RSA" or "UNKNOWN", may be null
 * @param bitLength   key size in bits, may be null
 * @param source      file path for {@link KeyMode#KEY_FILE_PATH}, otherwise null
 */
public record KeyDescriptor(
        KeyMode mode,
        KeyAlgorithm algorithm,
        String fingerprint,
        String keyType,
        Integer bitLength,
        String source
) {
    public static final String UNKNOWN_KEY_TYPE = "UNKNOWN";

    public KeyDescriptor {
        Objects.requireNonNull(mode, "Mode is required");
        Objects.requireNonNull(algorithm, "Algorithm is required");
    }

    public Optional<String> fingerprintValue() {
        return Optional.ofNullable(fingerprint);
    }

    public Optional<String> keyTypeValue() {
        return Optional.ofNullable(keyType);
    }

    /**
     * Short label for logs, e.g. {@code RS256(path=/etc/keys/jwt.pem)} or {@code HS256(secret)}.
     */
    public String label() {
        return switch (mode) {
            case INLINE_SECRET -> "HS256(secret)";
            case INLINE_KEY_TEXT -> "RS256(inline)";
            case KEY_FILE_PATH -> "RS256(path=" + source + ")";
        };
    }
}
