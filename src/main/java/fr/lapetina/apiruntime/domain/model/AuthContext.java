package fr.lapetina.apiruntime.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of authenticating a request.
 *
 * @param subject authenticated subject id, null for anonymous callers
 * @param scopes  granted scopes
 */
public record AuthContext(String subject, List<String> scopes) {

    public static final String ADMIN_SCOPE = "admin";

    public AuthContext {
        scopes = scopes != null ? List.copyOf(scopes) : List.of();
    }

    public static AuthContext anonymous() {
        return new AuthContext(null, List.of("anonymous"));
    }

    public Optional<String> subjectValue() {
        return Optional.ofNullable(subject);
    }

    public boolean isAuthenticated() {
        return subject != null;
    }

    public boolean hasScope(String scope) {
        return scopes.contains(scope);
    }

    public boolean isAdmin() {
        return hasScope(ADMIN_SCOPE);
    }
}
