package hle.affinity.config;

import hle.affinity.dispatch.DispatcherConfig;
import hle.affinity.pool.AffinityPoolConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PoolConfigLoaderTest {

    private final PoolConfigLoader loader = new PoolConfigLoader();

    @Test
    void shouldLoadFullConfiguration() throws IOException, URISyntaxException {
        Path file = Paths.get(getClass().getResource("/service-config.json").toURI());

        ServiceConfig config = loader.load(file);

        assertEquals("info", config.getLogLevel());
        assertEquals(Duration.ofSeconds(10), config.getShutdownTimeout());

        AffinityPoolConfig pool = config.getPool();
        assertEquals("Srvr=\"app01\";Ref=\"orders\";", pool.getConnectionTarget());
        assertEquals("V83.COMConnector", pool.getEntryPoint());
        assertEquals(1, pool.getMinPoolSize());
        assertEquals(4, pool.getMaxPoolSize());
        assertEquals(Duration.ofMinutes(5), pool.getIdleTimeout());
        assertEquals(Duration.ofSeconds(10), pool.getWaitConnTimeout());
        assertEquals(Duration.ofMinutes(1), pool.getCleanupInterval());
        assertEquals(Duration.ofSeconds(30), pool.getWorkerShutdownTimeout());
        assertEquals(100, pool.getCommandQueueCapacity());

        DispatcherConfig dispatcher = config.getDispatcher();
        assertEquals(4, dispatcher.getConcurrency());
        assertEquals(1000, dispatcher.getQueueCapacity());
        assertEquals(DispatcherConfig.RejectionPolicy.BLOCK, dispatcher.getRejectionPolicy());
        assertEquals(Duration.ofSeconds(10), dispatcher.getDrainTimeout());
    }

    @Test
    void shouldIgnoreByteOrderMark(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("bom.json");
        byte[] bom = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
        byte[] body = "{\"pool\":{\"maxPoolSize\":3}}".getBytes(StandardCharsets.UTF_8);
        byte[] content = new byte[bom.length + body.length];
        System.arraycopy(bom, 0, content, 0, bom.length);
        System.arraycopy(body, 0, content, bom.length, body.length);
        Files.write(file, content);

        ServiceConfig config = loader.load(file);

        assertEquals(3, config.getPool().getMaxPoolSize());
    }

    @Test
    void shouldFallBackToDefaults() {
        ServiceConfig config = loader.parse("{}");

        assertEquals(ServiceConfig.DEFAULT_LOG_LEVEL, config.getLogLevel());
        assertEquals(ServiceConfig.DEFAULT_SHUTDOWN_TIMEOUT, config.getShutdownTimeout());
        assertEquals(AffinityPoolConfig.DEFAULT_ENTRY_POINT, config.getPool().getEntryPoint());
        assertEquals(AffinityPoolConfig.DEFAULT_IDLE_TIMEOUT, config.getPool().getIdleTimeout());
        assertEquals(10, config.getDispatcher().getConcurrency());
    }

    @Test
    void shouldUseShutdownTimeoutAsDrainTimeout() {
        ServiceConfig config = loader.parse("{\"shutdownTimeout\":\"2s\"}");

        assertEquals(Duration.ofSeconds(2), config.getShutdownTimeout());
        assertEquals(Duration.ofSeconds(2), config.getDispatcher().getDrainTimeout());
    }

    @Test
    void shouldAcceptNanosecondNumbersForDurations() {
        ServiceConfig config = loader.parse("{\"pool\":{\"idleTimeout\":1500000000,\"waitConnTimeout\":\"250ms\"}}");

        assertEquals(Duration.ofMillis(1500), config.getPool().getIdleTimeout());
        assertEquals(Duration.ofMillis(250), config.getPool().getWaitConnTimeout());
    }

    @Test
    void shouldKeepOutOfRangeValuesForPoolToNormalize() {
        ServiceConfig config = loader.parse("{\"pool\":{\"minPoolSize\":0,\"maxPoolSize\":-2}}");

        assertEquals(0, config.getPool().getMinPoolSize());
        AffinityPoolConfig normalized = config.getPool().normalize();
        assertEquals(1, normalized.getMinPoolSize());
        assertEquals(1, normalized.getMaxPoolSize());
    }

    @Test
    void shouldNameFieldWithInvalidDuration() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> loader.parse("{\"pool\":{\"idleTimeout\":\"five minutes\"}}"));

        assertTrue(e.getMessage().startsWith("pool.idleTimeout"), e.getMessage());
    }

    @Test
    void shouldNameFieldWithWrongType() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> loader.parse("{\"pool\":{\"maxPoolSize\":\"four\"}}"));
        assertEquals("pool.maxPoolSize: expected an integer", e.getMessage());

        e = assertThrows(IllegalArgumentException.class,
                () -> loader.parse("{\"dispatcher\":{\"rejectionPolicy\":\"DROP\"}}"));
        assertTrue(e.getMessage().startsWith("dispatcher.rejectionPolicy"), e.getMessage());

        e = assertThrows(IllegalArgumentException.class,
                () -> loader.parse("{\"dispatcher\":{\"concurrency\":0}}"));
        assertEquals("dispatcher.concurrency must be >= 1", e.getMessage());

        e = assertThrows(IllegalArgumentException.class, () -> loader.parse("{\"pool\":[]}"));
        assertEquals("pool: expected an object", e.getMessage());
    }

    @Test
    void shouldRejectMalformedJson() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> loader.parse("{\"pool\": {"));
        assertTrue(e.getMessage().startsWith("Malformed configuration"), e.getMessage());

        assertThrows(IllegalArgumentException.class, () -> loader.parse(""));
        assertThrows(IllegalArgumentException.class, () -> loader.parse("[1, 2]"));
    }

    @Test
    void shouldReportMissingFile(@TempDir Path dir) {
        assertThrows(NoSuchFileException.class, () -> loader.load(dir.resolve("missing.json")));
    }
}
