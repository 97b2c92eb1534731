package hle.affinity;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import hle.affinity.config.PoolConfigLoader;
import hle.affinity.config.ServiceConfig;
import hle.affinity.dispatch.CommandDispatcher;
import hle.affinity.dispatch.CommandResult;
import hle.affinity.pool.AffinityPool;
import hle.affinity.pool.PoolStatus;
import hle.affinity.pool.ResourceStats;
import hle.affinity.simulated.SimulatedBackend;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Command-line load runner: pushes echo commands through a {@link CommandDispatcher}
 * into an {@link AffinityPool} backed by a {@link SimulatedBackend} and prints a summary.
 */
public final class App {
    private static final int DEFAULT_REQUESTS = 1_000;
    private static final int DEFAULT_CONCURRENCY = 8;
    private static final int DEFAULT_MIN_LATENCY_MS = 5;
    private static final int DEFAULT_MAX_LATENCY_MS = 20;
    private static final double DEFAULT_FAILURE_RATE = 0.0;

    private App() {
    }

    public static void main(String[] args) {
        int exitCode = run(args, System.out, System.err);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Map<String, String> options;
        try {
            options = parseArgs(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            printUsage(out);
            return 2;
        }

        if (options.containsKey("help")) {
            printUsage(out);
            return 0;
        }

        int requests;
        int concurrency;
        int minLatencyMs;
        int maxLatencyMs;
        double failureRate;
        ServiceConfig config;
        try {
            requests = getIntOption(options, "requests", DEFAULT_REQUESTS);
            concurrency = getIntOption(options, "concurrency", DEFAULT_CONCURRENCY);
            minLatencyMs = getIntOption(options, "min-latency-ms", DEFAULT_MIN_LATENCY_MS);
            maxLatencyMs = getIntOption(options, "max-latency-ms", DEFAULT_MAX_LATENCY_MS);
            failureRate = getDoubleOption(options, "failure-rate", DEFAULT_FAILURE_RATE);
            config = loadConfig(options.get("config"));
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return 2;
        } catch (IOException e) {
            err.println("Cannot read configuration: " + e.getMessage());
            return 2;
        }

        if (!validateOptions(err, requests, concurrency, minLatencyMs, maxLatencyMs, failureRate)) {
            return 2;
        }
        applyLogLevel(config.getLogLevel());

        SimulatedBackend backend = SimulatedBackend.builder()
                .latency(minLatencyMs, maxLatencyMs)
                .failureRate(failureRate)
                .build();

        try (CommandDispatcher dispatcher = new CommandDispatcher(
                new AffinityPool(config.getPool(), backend),
                config.getDispatcher().toBuilder().concurrency(concurrency).build())) {

            long start = System.nanoTime();
            List<CompletableFuture<CommandResult<byte[]>>> futures = new ArrayList<>(requests);
            for (int i = 0; i < requests; i++) {
                futures.add(dispatcher.submit("req-" + i, "echo", "{\"request\":" + i + "}"));
            }
            List<CommandResult<byte[]>> results = dispatcher.awaitAll(futures);
            LatencyStats stats = LatencyStats.of(results, Duration.ofNanos(System.nanoTime() - start));

            printSummary(out, config, requests, concurrency, stats, dispatcher.getPool().status());
            return stats.getFailures() == requests ? 1 : 0;
        } catch (RuntimeException e) {
            err.println("Run failed: " + e.getMessage());
            return 1;
        }
    }

    private static ServiceConfig loadConfig(String file) throws IOException {
        if (file == null) {
            return ServiceConfig.defaults();
        }
        Path path = Paths.get(file);
        return new PoolConfigLoader().load(path);
    }

    private static void applyLogLevel(String level) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext) {
            ((LoggerContext) factory).getLogger("hle.affinity").setLevel(Level.toLevel(level, Level.INFO));
        }
    }

    private static boolean validateOptions(PrintStream err,
                                           int requests,
                                           int concurrency,
                                           int minLatencyMs,
                                           int maxLatencyMs,
                                           double failureRate) {
        if (requests <= 0) {
            err.println("requests must be > 0");
            return false;
        }
        if (concurrency <= 0) {
            err.println("concurrency must be > 0");
            return false;
        }
        if (minLatencyMs < 0 || maxLatencyMs < minLatencyMs) {
            err.println("latency must satisfy 0 <= min-latency-ms <= max-latency-ms");
            return false;
        }
        if (failureRate < 0.0 || failureRate > 1.0) {
            err.println("failure-rate must be between 0.0 and 1.0");
            return false;
        }
        return true;
    }

    private static void printSummary(PrintStream out,
                                     ServiceConfig config,
                                     int requests,
                                     int concurrency,
                                     LatencyStats stats,
                                     PoolStatus status) {
        out.println("=== Run Summary ===");
        out.printf("requests=%d, concurrency=%d, minPoolSize=%d, maxPoolSize=%d%n",
                requests, concurrency, config.getPool().getMinPoolSize(), config.getPool().getMaxPoolSize());
        out.printf("totalTime=%.2fs, throughput=%.2f req/s, failures=%d%n",
                millis(stats.getWallTime()) / 1000.0, stats.getThroughputPerSec(), stats.getFailures());
        stats.getFailuresByType().forEach((type, count) -> out.printf("  %s: %d%n", type, count));
        out.printf("latencyMs: avg=%.2f, p50=%.2f, p95=%.2f, max=%.2f%n",
                millis(stats.getAverage()), millis(stats.percentile(0.50)),
                millis(stats.percentile(0.95)), millis(stats.percentile(1.0)));
        stats.getSlowestCommandId().ifPresent(id -> out.printf("slowest command: %s%n", id));
        out.printf("pool: active=%d, idle=%d, max=%d%n",
                status.getActiveCount(), status.getIdleCount(), status.getMaxPoolSize());
        for (ResourceStats resource : status.getResources()) {
            out.printf("  resource %d: uses=%d, lastUsed=%s%n",
                    resource.getId(), resource.getUseCount(), resource.getLastUsed());
        }
    }

    private static double millis(Duration duration) {
        return duration.toNanos() / 1_000_000.0;
    }

    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> options = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--help".equals(arg) || "-h".equals(arg)) {
                options.put("help", "true");
                continue;
            }
            if (!arg.startsWith("--")) {
                throw new IllegalArgumentException("Unknown argument: " + arg);
            }
            String key = arg.substring(2);
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for --" + key);
            }
            options.put(key, args[++i]);
        }
        return options;
    }

    private static int getIntOption(Map<String, String> options, String key, int defaultValue) {
        String raw = options.get(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for --" + key + ": " + raw);
        }
    }

    private static double getDoubleOption(Map<String, String> options, String key, double defaultValue) {
        String raw = options.get(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for --" + key + ": " + raw);
        }
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: java -cp <classpath> hle.affinity.App [options]");
        out.println("Options:");
        out.println("  --config <file>          JSON configuration file (default: built-in defaults)");
        out.println("  --requests <int>         Total number of commands (default: " + DEFAULT_REQUESTS + ")");
        out.println("  --concurrency <int>      Dispatcher threads (default: " + DEFAULT_CONCURRENCY + ")");
        out.println("  --min-latency-ms <int>   Minimum simulated backend latency (default: " + DEFAULT_MIN_LATENCY_MS + ")");
        out.println("  --max-latency-ms <int>   Maximum simulated backend latency (default: " + DEFAULT_MAX_LATENCY_MS + ")");
        out.println("  --failure-rate <double>  Simulated failure probability (default: " + DEFAULT_FAILURE_RATE + ")");
        out.println("  --help                   Show this help");
    }
}
