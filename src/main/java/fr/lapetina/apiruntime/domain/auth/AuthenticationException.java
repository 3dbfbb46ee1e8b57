package fr.lapetina.apiruntime.domain.auth;

/**
 * Thrown when a presented bearer token cannot be accepted.
 */
public final class AuthenticationException extends RuntimeException {

    private final Reason reason;

    public AuthenticationException(Reason reason) {
        super(reason.getMessage());
        this.reason = reason;
    }

    public AuthenticationException(Reason reason, Throwable cause) {
        super(reason.getMessage(), cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        AUTHENTICATION_FAILED("authentication failed"),
        TOKEN_EXPIRED("token expired"),
        INVALID_TOKEN_FORMAT("invalid token format");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
