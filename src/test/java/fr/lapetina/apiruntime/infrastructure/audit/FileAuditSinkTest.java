package fr.lapetina.apiruntime.infrastructure.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.apiruntime.infrastructure.config.ApiServerConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileAuditSinkTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("should create the directory and append JSON lines")
    void shouldAppendJsonLines() throws Exception {
        Path logDir = tempDir.resolve("nested/logs");
        FileAuditSink sink = new FileAuditSink(logDir);

        ObjectNode metadata = JsonNodeFactory.instance.objectNode().put("path", "/api/whoami");
        sink.append(AuditEntry.now("audit", "GET /api/whoami", metadata));
        sink.append(AuditEntry.now("audit", "POST /admin/reload", null));

        List<String> lines = Files.readAllLines(logDir.resolve(FileAuditSink.FILE_NAME));
        assertThat(lines).hasSize(2);

        JsonNode first = objectMapper.readTree(lines.get(0));
        assertThat(first.get("category").asText()).isEqualTo("audit");
        assertThat(first.get("message").asText()).isEqualTo("GET /api/whoami");
        assertThat(first.get("metadata").get("path").asText()).isEqualTo("/api/whoami");
        assertThat(first.get("timestamp").asText()).isNotBlank();

        JsonNode second = objectMapper.readTree(lines.get(1));
        assertThat(second.get("metadata").isObject()).isTrue();
    }

    @Test
    @DisplayName("should keep appending to an existing file")
    void shouldAppendToExistingFile() throws Exception {
        Files.writeString(tempDir.resolve(FileAuditSink.FILE_NAME), "{\"existing\":true}\n");
        FileAuditSink sink = new FileAuditSink(tempDir);

        sink.append(AuditEntry.now("audit", "GET /health", null));

        List<String> lines = Files.readAllLines(sink.getFile());
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).contains("existing");
    }

    @Test
    @DisplayName("should not interleave lines under concurrent appends")
    void shouldSerializeConcurrentAppends() throws Exception {
        FileAuditSink sink = new FileAuditSink(tempDir);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                int n = i;
                futures.add(executor.submit(() -> sink.append(AuditEntry.now("audit", "request " + n, null))));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        List<String> lines = Files.readAllLines(sink.getFile());
        assertThat(lines).hasSize(100);
        for (String line : lines) {
            assertThat(objectMapper.readTree(line).get("category").asText()).isEqualTo("audit");
        }
    }

    @Test
    @DisplayName("should raise AuditException when the file cannot be written")
    void shouldFailWhenDirectoryIsAFile() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");
        FileAuditSink sink = new FileAuditSink(blocker);

        assertThatThrownBy(() -> sink.append(AuditEntry.now("audit", "GET /", null)))
                .isInstanceOf(AuditException.class)
                .hasMessageContaining(FileAuditSink.FILE_NAME);
    }

    @Test
    @DisplayName("should pick the sink from the logging configuration")
    void shouldSelectSinkFromConfig() {
        AuditSink slf4j = AuditSinks.fromConfig(ApiServerConfig.LoggingConfig.of("info", null));
        AuditSink file = AuditSinks.fromConfig(ApiServerConfig.LoggingConfig.of("info", tempDir.toString()));

        assertThat(slf4j).isInstanceOf(Slf4jAuditSink.class);
        assertThat(slf4j.describe()).isEqualTo("logger:audit");
        assertThat(file).isInstanceOf(FileAuditSink.class);
        assertThat(file.describe()).isEqualTo("file:" + tempDir.resolve(FileAuditSink.FILE_NAME));
    }
}
