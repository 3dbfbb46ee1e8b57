package fr.lapetina.apiruntime.infrastructure.audit;

/**
 * Raised when an audit entry cannot be recorded.
 */
public class AuditException extends RuntimeException {

    public AuditException(String message, Throwable cause) {
        super(message, cause);
    }
}
