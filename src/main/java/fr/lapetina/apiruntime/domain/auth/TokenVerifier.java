package fr.lapetina.apiruntime.domain.auth;

import fr.lapetina.apiruntime.domain.model.AuthContext;
import fr.lapetina.apiruntime.domain.model.KeyDescriptor;

import java.util.Optional;

/**
 * Verifies bearer tokens presented by API callers.
 * Implementations are immutable and safe to share between request threads.
 */
public interface TokenVerifier {

    /**
     * Authenticates a request.
     *
     * @param authorization raw Authorization header value, may be null
     * @return the caller's context; anonymous when no token was presented
     * @throws AuthenticationException if a token was presented but is not acceptable
     */
    AuthContext authenticate(String authorization);

    /**
     * Metadata of the key this verifier was built from, when there is one.
     */
    default Optional<KeyDescriptor> keyDescriptor() {
        return Optional.empty();
    }
}
