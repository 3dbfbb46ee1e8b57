package fr.lapetina.apiruntime.domain.auth;

import fr.lapetina.apiruntime.domain.model.AuthContext;
import fr.lapetina.apiruntime.domain.model.KeyDescriptor;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;

import javax.crypto.SecretKey;
import java.security.PublicKey;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JWT bearer token verifier for HS256 (shared secret) and RS256 (RSA public key).
 *
 * Each verifier accepts exactly one algorithm: a token whose header names any
 * other algorithm is rejected even when its signature checks out against the key.
 *
 * Expiry is checked with a grace period (60 seconds by default). Scopes come from
 * the space-separated {@code scope} claim, else the {@code scopes} array claim,
 * else default to {@code user}.
 */
public final class JwtTokenVerifier implements TokenVerifier {

    public static final long DEFAULT_EXP_GRACE_SECONDS = 60;

    private static final String BEARER_PREFIX = "bearer ";
    private static final List<String> DEFAULT_SCOPES = List.of("user");

    static final String HS256 = "HS256";
    static final String RS256 = "RS256";

    private final JwtParser parser;
    private final String algorithm;
    private final KeyDescriptor descriptor;

    private JwtTokenVerifier(JwtParser parser, String algorithm, KeyDescriptor descriptor) {
        this.parser = parser;
        this.algorithm = algorithm;
        this.descriptor = descriptor;
    }

    public static JwtTokenVerifier hs256(SecretKey key, KeyDescriptor descriptor) {
        return hs256(key, descriptor, DEFAULT_EXP_GRACE_SECONDS);
    }

    public static JwtTokenVerifier hs256(SecretKey key, KeyDescriptor descriptor, long expGraceSeconds) {
        Objects.requireNonNull(key, "Secret key is required");
        JwtParser parser = Jwts.parser()
                .verifyWith(key)
                .clockSkewSeconds(expGraceSeconds)
                .build();
        return new JwtTokenVerifier(parser, HS256, descriptor);
    }

    public static JwtTokenVerifier rs256(PublicKey key, KeyDescriptor descriptor) {
        return rs256(key, descriptor, DEFAULT_EXP_GRACE_SECONDS);
    }

    public static JwtTokenVerifier rs256(PublicKey key, KeyDescriptor descriptor, long expGraceSeconds) {
        Objects.requireNonNull(key, "Public key is required");
        JwtParser parser = Jwts.parser()
                .verifyWith(key)
                .clockSkewSeconds(expGraceSeconds)
                .build();
        return new JwtTokenVerifier(parser, RS256, descriptor);
    }

    @Override
    public AuthContext authenticate(String authorization) {
        if (authorization == null || authorization.isBlank()) {
            return AuthContext.anonymous();
        }
        String token = stripBearer(authorization);

        Jws<Claims> jws;
        try {
            jws = parser.parseSignedClaims(token);
        } catch (ExpiredJwtException e) {
            throw new AuthenticationException(AuthenticationException.Reason.TOKEN_EXPIRED, e);
        } catch (MalformedJwtException e) {
            throw new AuthenticationException(AuthenticationException.Reason.INVALID_TOKEN_FORMAT, e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthenticationException(AuthenticationException.Reason.AUTHENTICATION_FAILED, e);
        }

        if (!algorithm.equals(jws.getHeader().getAlgorithm())) {
            throw new AuthenticationException(AuthenticationException.Reason.AUTHENTICATION_FAILED);
        }
        Claims claims = jws.getPayload();

        String subject = claims.getSubject();
        if (subject != null && subject.isBlank()) {
            subject = null;
        }
        return new AuthContext(subject, extractScopes(claims));
    }

    /**
     * The only {@code alg} header value this verifier accepts.
     */
    public String algorithm() {
        return algorithm;
    }

    @Override
    public Optional<KeyDescriptor> keyDescriptor() {
        return Optional.ofNullable(descriptor);
    }

    static String stripBearer(String authorization) {
        String trimmed = authorization.trim();
        if (trimmed.length() > BEARER_PREFIX.length()
                && trimmed.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return trimmed.substring(BEARER_PREFIX.length()).trim();
        }
        return trimmed;
    }

    private static List<String> extractScopes(Claims claims) {
        Object scope = claims.get("scope");
        if (scope instanceof String s) {
            return Arrays.stream(s.trim().split("\\s+"))
                    .filter(part -> !part.isEmpty())
                    .toList();
        }
        Object scopes = claims.get("scopes");
        if (scopes instanceof Collection<?> values) {
            return values.stream()
                    .map(String::valueOf)
                    .toList();
        }
        return DEFAULT_SCOPES;
    }

    @Override
    public String toString() {
        return "JwtTokenVerifier{" +
                "algorithm=" + algorithm +
                ", key=" + (descriptor != null ? descriptor.label() : "n/a") +
                '}';
    }
}
