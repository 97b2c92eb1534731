package hle.affinity.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import hle.affinity.dispatch.DispatcherConfig;
import hle.affinity.pool.AffinityPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.function.Consumer;

/**
 * Reads a {@link ServiceConfig} from a JSON document.
 *
 * <p>Expected layout; every field is optional and falls back to its default:
 * <pre>{@code
 * {
 *   "logLevel": "info",
 *   "shutdownTimeout": "10s",
 *   "pool": {
 *     "connectionTarget": "Srvr=\"app01\";Ref=\"orders\";",
 *     "entryPoint": "V83.COMConnector",
 *     "minPoolSize": 1,
 *     "maxPoolSize": 4,
 *     "idleTimeout": "5m",
 *     "waitConnTimeout": "10s",
 *     "cleanupInterval": "1m",
 *     "workerShutdownTimeout": "30s",
 *     "commandQueueCapacity": 100,
 *     "commandSubmitTimeout": "10s"
 *   },
 *   "dispatcher": {
 *     "concurrency": 4,
 *     "queueCapacity": 1000,
 *     "rejectionPolicy": "BLOCK"
 *   }
 * }
 * }</pre>
 * Durations are either strings accepted by {@link Durations#parse(String)} or plain
 * numbers of nanoseconds. A UTF-8 byte order mark in front of the document is ignored.
 */
public final class PoolConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(PoolConfigLoader.class);
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Reads and parses a configuration file.
     *
     * @throws IOException if the file can not be read
     * @throws IllegalArgumentException if the content is not a valid configuration
     */
    public ServiceConfig load(Path file) throws IOException {
        String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        ServiceConfig config = parse(content);
        logger.info("Loaded configuration from {}", file);
        return config;
    }

    /**
     * Parses a configuration document.
     *
     * @throws IllegalArgumentException if the JSON is malformed or a field has the wrong type;
     *         the message names the offending field
     */
    public ServiceConfig parse(String json) {
        String content = json;
        if (!content.isEmpty() && content.charAt(0) == BYTE_ORDER_MARK) {
            content = content.substring(1);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed configuration: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode() || !root.isObject()) {
            throw new IllegalArgumentException("Configuration must be a JSON object");
        }

        String logLevel = textOrDefault(root, "logLevel", ServiceConfig.DEFAULT_LOG_LEVEL);
        Duration shutdownTimeout = duration(root, "shutdownTimeout");
        if (shutdownTimeout == null || shutdownTimeout.isZero()) {
            shutdownTimeout = ServiceConfig.DEFAULT_SHUTDOWN_TIMEOUT;
        }

        AffinityPoolConfig pool = parsePool(section(root, "pool"));
        DispatcherConfig dispatcher = parseDispatcher(section(root, "dispatcher"), shutdownTimeout);
        return new ServiceConfig(pool, dispatcher, logLevel, shutdownTimeout);
    }

    private AffinityPoolConfig parsePool(JsonNode node) {
        AffinityPoolConfig.Builder builder = AffinityPoolConfig.builder();
        if (node == null) {
            return builder.build();
        }
        String prefix = "pool.";
        ifPresent(text(node, prefix, "connectionTarget"), builder::connectionTarget);
        ifPresent(text(node, prefix, "entryPoint"), builder::entryPoint);
        ifPresent(integer(node, prefix, "minPoolSize"), builder::minPoolSize);
        ifPresent(integer(node, prefix, "maxPoolSize"), builder::maxPoolSize);
        ifPresent(duration(node, prefix + "idleTimeout"), builder::idleTimeout);
        ifPresent(duration(node, prefix + "waitConnTimeout"), builder::waitConnTimeout);
        ifPresent(duration(node, prefix + "cleanupInterval"), builder::cleanupInterval);
        ifPresent(duration(node, prefix + "workerShutdownTimeout"), builder::workerShutdownTimeout);
        ifPresent(integer(node, prefix, "commandQueueCapacity"), builder::commandQueueCapacity);
        ifPresent(duration(node, prefix + "commandSubmitTimeout"), builder::commandSubmitTimeout);
        return builder.build();
    }

    private DispatcherConfig parseDispatcher(JsonNode node, Duration drainTimeout) {
        DispatcherConfig.Builder builder = DispatcherConfig.builder().drainTimeout(drainTimeout);
        if (node == null) {
            return builder.build();
        }
        String prefix = "dispatcher.";
        Integer concurrency = integer(node, prefix, "concurrency");
        Integer queueCapacity = integer(node, prefix, "queueCapacity");
        try {
            ifPresent(concurrency, builder::concurrency);
            ifPresent(queueCapacity, builder::queueCapacity);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(prefix + e.getMessage(), e);
        }
        String policy = text(node, prefix, "rejectionPolicy");
        if (policy != null) {
            try {
                builder.rejectionPolicy(DispatcherConfig.RejectionPolicy.valueOf(policy.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(prefix + "rejectionPolicy: unknown policy \"" + policy + "\"", e);
            }
        }
        return builder.build();
    }

    private static JsonNode section(JsonNode root, String name) {
        JsonNode node = root.get(name);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException(name + ": expected an object");
        }
        return node;
    }

    private static String textOrDefault(JsonNode node, String field, String defaultValue) {
        String value = text(node, "", field);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    private static String text(JsonNode node, String prefix, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new IllegalArgumentException(prefix + field + ": expected a string");
        }
        return value.asText();
    }

    private static Integer integer(JsonNode node, String prefix, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new IllegalArgumentException(prefix + field + ": expected an integer");
        }
        return value.intValue();
    }

    /**
     * Reads a duration given as a string with units or as a number of nanoseconds.
     */
    private static Duration duration(JsonNode node, String path) {
        String field = path.substring(path.lastIndexOf('.') + 1);
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return Duration.ofNanos(value.longValue());
        }
        if (value.isTextual()) {
            try {
                return Durations.parse(value.asText());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(path + ": " + e.getMessage(), e);
            }
        }
        throw new IllegalArgumentException(path + ": expected a duration string or a number of nanoseconds");
    }

    private static <T> void ifPresent(T value, Consumer<T> setter) {
        if (value != null) {
            setter.accept(value);
        }
    }
}
