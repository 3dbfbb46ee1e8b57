package fr.lapetina.apiruntime.infrastructure.keys;

import fr.lapetina.apiruntime.domain.auth.JwtTokenVerifier;
import fr.lapetina.apiruntime.domain.model.KeyAlgorithm;
import fr.lapetina.apiruntime.domain.model.KeyDescriptor;
import fr.lapetina.apiruntime.domain.model.KeyMode;
import fr.lapetina.apiruntime.infrastructure.config.ApiServerConfig;
import fr.lapetina.apiruntime.infrastructure.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.spec.SecretKeySpec;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.cert.CertificateFactory;
import java.security.spec.RSAPublicKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.List;
import java.util.Optional;

/**
 * Turns the {@code auth} configuration section into a token verifier plus an
 * auditable {@link KeyDescriptor}.
 *
 * Key material is taken from the first populated option, in this order:
 * <ol>
 *     <li>{@code auth.jwtPem}: inline PEM text</li>
 *     <li>{@code auth.jwtPemPath}: PEM file, read as UTF-8</li>
 *     <li>{@code auth.jwtSecret}: HS256 shared secret</li>
 * </ol>
 * Lower-priority options are ignored when a higher one is set.
 *
 * Metadata (fingerprint, key type, size) is best effort: a key whose structure
 * cannot be recognized is still accepted and reported as {@code UNKNOWN}. PEM keys
 * always verify RS256, so a non-RSA public key never authenticates a token.
 */
public final class KeyMaterialResolver {

    private static final Logger log = LoggerFactory.getLogger(KeyMaterialResolver.class);

    // Shorter HS256 keys are refused by the JWT parser when verifying
    static final int MIN_SECRET_BYTES = 32;

    private static final String RSA = "RSA";
    private static final List<String> SPKI_ALGORITHMS = List.of("RSA", "EC");

    private final long expGraceSeconds;

    public KeyMaterialResolver() {
        this(JwtTokenVerifier.DEFAULT_EXP_GRACE_SECONDS);
    }

    public KeyMaterialResolver(long expGraceSeconds) {
        this.expGraceSeconds = expGraceSeconds;
    }

    /**
     * @throws ConfigurationException if nothing is configured, the key file cannot be
     *                                read, or the key material is malformed
     */
    public ResolvedKey resolve(ApiServerConfig.AuthConfig auth) {
        ResolvedKey resolved;
        if (hasText(auth.jwtPem())) {
            resolved = fromKeyText(auth.jwtPem(), KeyMode.INLINE_KEY_TEXT, null);
        } else if (hasText(auth.jwtPemPath())) {
            String path = auth.jwtPemPath().trim();
            resolved = fromKeyText(readKeyFile(path), KeyMode.KEY_FILE_PATH, path);
        } else if (hasText(auth.jwtSecret())) {
            resolved = fromSecret(auth.jwtSecret());
        } else {
            throw new ConfigurationException(
                    "no JWT key material configured: set one of auth.jwtPem, auth.jwtPemPath, auth.jwtSecret");
        }

        KeyDescriptor descriptor = resolved.descriptor();
        log.info("JWT key material resolved: key={}, fingerprint={}, keyType={}, bits={}",
                descriptor.label(),
                descriptor.fingerprintValue().orElse("-"),
                descriptor.keyTypeValue().orElse("-"),
                descriptor.bitLength() != null ? descriptor.bitLength() : "-");
        return resolved;
    }

    private ResolvedKey fromSecret(String secret) {
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            log.warn("auth.jwtSecret is {} bits, HS256 tokens are only verified with at least {} bits",
                    bytes.length * 8, MIN_SECRET_BYTES * 8);
        }
        SecretKeySpec key = new SecretKeySpec(bytes, "HmacSHA256");
        KeyDescriptor descriptor = new KeyDescriptor(
                KeyMode.INLINE_SECRET,
                KeyAlgorithm.SHARED_SECRET,
                Fingerprints.sha256Prefix(bytes),
                "HS256",
                bytes.length * 8,
                null
        );
        return new ResolvedKey(JwtTokenVerifier.hs256(key, descriptor, expGraceSeconds), descriptor);
    }

    private ResolvedKey fromKeyText(String text, KeyMode mode, String source) {
        PemDocument pem = PemDocument.parse(text);
        PublicKey publicKey = toPublicKey(pem);

        Optional<Integer> bits = DerStructure.rsaModulusBits(pem.der());
        KeyDescriptor descriptor = new KeyDescriptor(
                mode,
                KeyAlgorithm.ASYMMETRIC_KEY_PAIR,
                Fingerprints.sha256Prefix(pem.der()),
                bits.isPresent() ? RSA : KeyDescriptor.UNKNOWN_KEY_TYPE,
                bits.orElse(null),
                source
        );
        if (!RSA.equals(publicKey.getAlgorithm())) {
            log.warn("PEM key algorithm is {}, tokens are verified as RS256 and will be rejected",
                    publicKey.getAlgorithm());
        }
        return new ResolvedKey(JwtTokenVerifier.rs256(publicKey, descriptor, expGraceSeconds), descriptor);
    }

    private PublicKey toPublicKey(PemDocument pem) {
        try {
            return switch (pem.label()) {
                case "PUBLIC KEY" -> fromSubjectPublicKeyInfo(pem.der());
                case "RSA PUBLIC KEY" -> fromPkcs1(pem.der());
                case "CERTIFICATE" -> CertificateFactory.getInstance("X.509")
                        .generateCertificate(new ByteArrayInputStream(pem.der()))
                        .getPublicKey();
                default -> throw new ConfigurationException("unsupported PEM block type: " + pem.label());
            };
        } catch (GeneralSecurityException e) {
            throw new ConfigurationException("malformed key material in PEM block " + pem.label()
                    + ": " + e.getMessage(), e);
        }
    }

    private PublicKey fromSubjectPublicKeyInfo(byte[] der) throws GeneralSecurityException {
        GeneralSecurityException last = null;
        for (String algorithm : SPKI_ALGORITHMS) {
            try {
                return KeyFactory.getInstance(algorithm).generatePublic(new X509EncodedKeySpec(der));
            } catch (GeneralSecurityException e) {
                last = e;
            }
        }
        throw last;
    }

    private PublicKey fromPkcs1(byte[] der) throws GeneralSecurityException {
        List<DerStructure.Element> elements;
        try {
            elements = DerStructure.parseAll(der);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("malformed key material in PEM block RSA PUBLIC KEY: "
                    + e.getMessage(), e);
        }
        if (elements.size() == 1
                && elements.get(0) instanceof DerStructure.Sequence sequence
                && sequence.children().size() == 2
                && sequence.children().get(0) instanceof DerStructure.DerInteger modulus
                && sequence.children().get(1) instanceof DerStructure.DerInteger exponent) {
            return KeyFactory.getInstance(RSA).generatePublic(new RSAPublicKeySpec(modulus.value(), exponent.value()));
        }
        throw new ConfigurationException("malformed key material in PEM block RSA PUBLIC KEY: "
                + "expected SEQUENCE of modulus and exponent");
    }

    private static String readKeyFile(String path) {
        try {
            return Files.readString(Path.of(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("failed to read auth.jwtPemPath " + path + ": " + e.getMessage(), e);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
