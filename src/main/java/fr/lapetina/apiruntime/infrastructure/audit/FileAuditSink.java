package fr.lapetina.apiruntime.infrastructure.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends audit entries as JSON lines to {@code <logDir>/audit.log}.
 *
 * The directory is created on the first append. Each append opens, writes and
 * closes the file; appends are serialized so lines never interleave.
 */
public final class FileAuditSink implements AuditSink {

    public static final String FILE_NAME = "audit.log";

    private final Path file;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public FileAuditSink(Path logDir) {
        this.file = logDir.resolve(FILE_NAME);
    }

    @Override
    public synchronized void append(AuditEntry entry) {
        String line = toJson(entry) + "\n";
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new AuditException("Failed to write audit entry to " + file, e);
        }
    }

    private String toJson(AuditEntry entry) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("timestamp", entry.timestamp().toString());
        node.put("category", entry.category());
        node.put("message", entry.message());
        node.set("metadata", entry.metadata());
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new AuditException("Failed to serialize audit entry", e);
        }
    }

    public Path getFile() {
        return file;
    }

    @Override
    public String describe() {
        return "file:" + file;
    }
}
