package fr.lapetina.apiruntime.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads {@link ApiServerConfig} from a YAML file.
 *
 * Supports:
 * - Loading from the file system, falling back to the classpath
 * - {@code APIRT_*} environment variables, which take precedence over file values
 *
 * Each call to {@link #load()} reads the source again; nothing is cached.
 */
public final class ConfigLoader implements ConfigSource {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final List<EnvOverride> ENV_OVERRIDES = List.of(
            new EnvOverride("APIRT_SERVER_HOST", "server", "host", ValueType.STRING),
            new EnvOverride("APIRT_SERVER_PORT", "server", "port", ValueType.INTEGER),
            new EnvOverride("APIRT_LOG_LEVEL", "logging", "level", ValueType.STRING),
            new EnvOverride("APIRT_LOG_DIR", "logging", "logDir", ValueType.STRING),
            new EnvOverride("APIRT_RATE_LIMIT_ENABLED", "rateLimit", "enabled", ValueType.BOOLEAN),
            new EnvOverride("APIRT_RATE_LIMIT_PER_IP", "rateLimit", "perIp", ValueType.BOOLEAN),
            new EnvOverride("APIRT_RATE_LIMIT_PER_USER", "rateLimit", "perUser", ValueType.BOOLEAN),
            new EnvOverride("APIRT_RATE_LIMIT_PER_SEC", "rateLimit", "ratePerSec", ValueType.DECIMAL),
            new EnvOverride("APIRT_RATE_LIMIT_BURST", "rateLimit", "burst", ValueType.INTEGER),
            new EnvOverride("APIRT_RATE_LIMIT_EXEMPT_PATHS", "rateLimit", "exemptPaths", ValueType.CSV),
            new EnvOverride("APIRT_JWT_PEM", "auth", "jwtPem", ValueType.STRING),
            new EnvOverride("APIRT_JWT_PEM_PATH", "auth", "jwtPemPath", ValueType.STRING),
            new EnvOverride("APIRT_JWT_SECRET", "auth", "jwtSecret", ValueType.STRING),
            new EnvOverride("APIRT_RELOAD_ENABLED", "reload", "enabled", ValueType.BOOLEAN),
            new EnvOverride("APIRT_RELOAD_INTERVAL_MS", "reload", "intervalMs", ValueType.INTEGER)
    );

    private final Path configPath;
    private final Map<String, String> environment;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ConfigLoader(String configPath) {
        this(configPath, System.getenv());
    }

    public ConfigLoader(String configPath, Map<String, String> environment) {
        this.configPath = Paths.get(configPath);
        this.environment = Map.copyOf(environment);
    }

    /**
     * Loads configuration from file or classpath, then applies environment overrides.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading fails
     */
    @Override
    public ApiServerConfig load() {
        Map<String, Object> tree = loadTree();
        applyEnvironment(tree);
        try {
            return objectMapper.convertValue(tree, ApiServerConfig.class);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Failed to bind configuration from " + configPath + ": " + e.getMessage(), e);
        }
    }

    private Map<String, Object> loadTree() {
        // Try file system first
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try (InputStream is = Files.newInputStream(configPath)) {
                return parse(is, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        // Try classpath
        String classpathResource = configPath.toString().replace('\\', '/');
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> parse(InputStream is, String origin) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object document;
        try {
            document = yaml.load(is);
        } catch (YAMLException e) {
            throw new ConfigurationException("Failed to parse YAML from " + origin + ": " + e.getMessage(), e);
        }
        if (document == null) {
            return new LinkedHashMap<>();
        }
        if (!(document instanceof Map)) {
            throw new ConfigurationException("Configuration root must be a mapping: " + origin);
        }
        return new LinkedHashMap<>((Map<String, Object>) document);
    }

    @SuppressWarnings("unchecked")
    private void applyEnvironment(Map<String, Object> tree) {
        for (EnvOverride override : ENV_OVERRIDES) {
            String raw = environment.get(override.variable());
            if (raw == null) {
                continue;
            }
            Object current = tree.get(override.section());
            Map<String, Object> section = current instanceof Map
                    ? new LinkedHashMap<>((Map<String, Object>) current)
                    : new LinkedHashMap<>();
            section.put(override.field(), override.type().convert(override.variable(), raw));
            tree.put(override.section(), section);
            log.debug("Configuration override from environment: variable={}", override.variable());
        }
    }

    /**
     * Parses the boolean spellings accepted in environment variables.
     */
    static boolean parseBoolean(String variable, String raw) {
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "1", "true", "yes", "y" -> true;
            case "0", "false", "no", "n" -> false;
            default -> throw new ConfigurationException("invalid " + variable + ": " + raw);
        };
    }

    static List<String> splitCsv(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private record EnvOverride(String variable, String section, String field, ValueType type) {
    }

    private enum ValueType {
        STRING,
        BOOLEAN,
        INTEGER,
        DECIMAL,
        CSV;

        Object convert(String variable, String raw) {
            try {
                return switch (this) {
                    case STRING -> raw;
                    case BOOLEAN -> parseBoolean(variable, raw);
                    case INTEGER -> Long.parseLong(raw.trim());
                    case DECIMAL -> Double.parseDouble(raw.trim());
                    case CSV -> splitCsv(raw);
                };
            } catch (NumberFormatException e) {
                throw new ConfigurationException("invalid " + variable + ": " + raw, e);
            }
        }
    }
}
