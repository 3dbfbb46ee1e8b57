package fr.lapetina.apiruntime.infrastructure.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.apiruntime.domain.auth.TokenVerifier;
import fr.lapetina.apiruntime.domain.swap.ComponentCell;
import fr.lapetina.apiruntime.infrastructure.audit.AuditEntry;
import fr.lapetina.apiruntime.infrastructure.audit.AuditSink;
import fr.lapetina.apiruntime.infrastructure.jobs.JobQueueClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Shared state handed to every request handler and to the reload loop.
 *
 * Created once at startup and passed by reference. The token verifier and the
 * audit sink live in {@link ComponentCell}s so they can be replaced while
 * requests are in flight; the job queue client and the update coordinator are
 * fixed for the life of the process.
 */
public final class RuntimeState {

    private static final Logger log = LoggerFactory.getLogger(RuntimeState.class);

    public static final String AUDIT_CATEGORY = "audit";

    private final ComponentCell<TokenVerifier> verifier;
    private final ComponentCell<AuditSink> auditSink;
    private final JobQueueClient jobQueue;
    private final UpdateCoordinator updates;

    public RuntimeState(
            TokenVerifier verifier,
            AuditSink auditSink,
            JobQueueClient jobQueue,
            UpdateCoordinator updates
    ) {
        this.verifier = new ComponentCell<>("verifier", verifier);
        this.auditSink = new ComponentCell<>("audit-sink", auditSink);
        this.jobQueue = Objects.requireNonNull(jobQueue, "Job queue client is required");
        this.updates = Objects.requireNonNull(updates, "Update coordinator is required");
    }

    public TokenVerifier verifier() {
        return verifier.read();
    }

    /**
     * Installs a new verifier.
     *
     * @return the verifier it replaced
     */
    public TokenVerifier swapVerifier(TokenVerifier replacement) {
        return verifier.swap(replacement);
    }

    public AuditSink auditSink() {
        return auditSink.read();
    }

    /**
     * Installs a new audit sink.
     *
     * @return the sink it replaced
     */
    public AuditSink swapAuditSink(AuditSink replacement) {
        return auditSink.swap(replacement);
    }

    public JobQueueClient jobQueue() {
        return jobQueue;
    }

    public UpdateCoordinator updates() {
        return updates;
    }

    /**
     * Records a request lifecycle entry on the current audit sink.
     *
     * Never fails the request: sink errors are logged and dropped.
     */
    public void audit(
            String method,
            String path,
            Map<String, String> pathParams,
            Map<String, String> query,
            JsonNode body
    ) {
        ObjectNode metadata = JsonNodeFactory.instance.objectNode();
        metadata.put("path", path);
        ObjectNode params = metadata.putObject("path_params");
        pathParams.forEach(params::put);
        ObjectNode queryNode = metadata.putObject("query");
        query.forEach(queryNode::put);
        metadata.set("body", body != null ? body : JsonNodeFactory.instance.nullNode());

        AuditEntry entry = AuditEntry.now(AUDIT_CATEGORY, method + " " + path, metadata);
        AuditSink sink = auditSink();
        try {
            sink.append(entry);
        } catch (RuntimeException e) {
            log.warn("Audit append failed, continuing: sink={}, method={}, path={}, error={}",
                    sink.describe(), method, path, e.getMessage());
        }
    }
}
