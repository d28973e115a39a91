package io.ledger.core;

import io.ledger.core.api.ApiServer;
import io.ledger.core.node.Node;
import io.ledger.core.node.NodeConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.function.Function;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Stream;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws Exception {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }
        configureLogging(options.logLevel());

        NodeConfig config = NodeConfig.defaultLocal()
                .withMaxRollbackBlocks(options.maxRollbackBlocks())
                .withLockTimeoutMillis(options.lockTimeoutMillis());

        Node node;
        if (options.inMemory()) {
            node = Node.inMemory(config);
            LOG.info("Using in-memory ledger store (state is lost on exit)");
        } else {
            Path dataPath = options.dataDir().toAbsolutePath().normalize();
            if (options.resetLedger()) {
                resetLedgerData(dataPath);
            }
            Files.createDirectories(dataPath);
            node = Node.rocks(config, dataPath.toString());
        }

        ApiServer apiServer = null;
        try {
            apiServer = new ApiServer(node.engine(), options.apiBind(), options.apiPort(), options.apiToken());
            apiServer.start();

            CountDownLatch shutdownLatch = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "utxo-ledger-shutdown"));
            LOG.info("Ledger running at height " + node.engine().getCurrentHeight()
                    + " (max rollback " + config.maxRollbackBlocks + " blocks). Press CTRL+C to exit.");
            shutdownLatch.await();
        } finally {
            if (apiServer != null) {
                apiServer.stop();
            }
            node.close();
        }
    }

    static void configureLogging(String levelName) {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Failed to load logging.properties: " + e.getMessage());
        }
        Level level = Level.parse(levelName);
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(level);
        }
    }

    private static void resetLedgerData(Path dataPath) {
        if (!Files.exists(dataPath)) {
            return;
        }
        try (Stream<Path> stream = Files.walk(dataPath)) {
            stream.sorted(Comparator.reverseOrder())
                    .filter(path -> !path.equals(dataPath))
                    .forEach(path -> {
                        try {
                            Files.deleteIfExists(path);
                        } catch (IOException e) {
                            throw new IllegalStateException("Failed to delete " + path, e);
                        }
                    });
        } catch (IOException e) {
            throw new IllegalStateException("Failed to reset ledger data in " + dataPath, e);
        }
        LOG.info("Cleared ledger data under " + dataPath);
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path dataDir,
            boolean inMemory,
            boolean resetLedger,
            String apiBind,
            int apiPort,
            String apiToken,
            long maxRollbackBlocks,
            long lockTimeoutMillis,
            String logLevel
    ) {
        static CliOptions parse(String[] args) {
            return parse(args, System::getenv);
        }

        static CliOptions parse(String[] args, Function<String, String> env) {
            boolean showHelp = false;
            String error = null;

            Path dataDir = Path.of(envOrDefault(env, "UTXO_LEDGER_DATA_DIR", "./data/ledger"));
            boolean inMemory = "memory".equalsIgnoreCase(env.apply("UTXO_LEDGER_STORE"));
            boolean reset = false;
            String apiBind = envOrDefault(env, "UTXO_LEDGER_API_BIND", "0.0.0.0");
            String apiToken = envOrDefault(env, "UTXO_LEDGER_API_TOKEN", null);
            int apiPort = 3000;
            long maxRollbackBlocks = NodeConfig.DEFAULT_MAX_ROLLBACK_BLOCKS;
            long lockTimeoutMillis = NodeConfig.DEFAULT_LOCK_TIMEOUT_MILLIS;
            String logLevel = envOrDefault(env, "UTXO_LEDGER_LOG_LEVEL", "INFO");

            try {
                String value = env.apply("UTXO_LEDGER_API_PORT");
                if (value != null && !value.isBlank()) {
                    apiPort = parsePort(value, "UTXO_LEDGER_API_PORT");
                }
                value = env.apply("UTXO_LEDGER_MAX_ROLLBACK_BLOCKS");
                if (value != null && !value.isBlank()) {
                    maxRollbackBlocks = parseNonNegativeLong(value, "UTXO_LEDGER_MAX_ROLLBACK_BLOCKS");
                }
                value = env.apply("UTXO_LEDGER_LOCK_TIMEOUT_MS");
                if (value != null && !value.isBlank()) {
                    lockTimeoutMillis = parsePositiveLong(value, "UTXO_LEDGER_LOCK_TIMEOUT_MS");
                }
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    try {
                        if ("--help".equals(arg) || "-h".equals(arg)) {
                            showHelp = true;
                        } else if (arg.startsWith("--data-dir=")) {
                            dataDir = Path.of(arg.substring("--data-dir=".length()));
                        } else if (arg.equals("--in-memory")) {
                            inMemory = true;
                        } else if (arg.equals("--reset-ledger")) {
                            reset = true;
                        } else if (arg.startsWith("--api-bind=")) {
                            apiBind = arg.substring("--api-bind=".length());
                        } else if (arg.startsWith("--api-port=")) {
                            apiPort = parsePort(arg.substring("--api-port=".length()), "--api-port");
                        } else if (arg.startsWith("--api-token=")) {
                            apiToken = arg.substring("--api-token=".length());
                        } else if (arg.startsWith("--max-rollback-blocks=")) {
                            maxRollbackBlocks = parseNonNegativeLong(
                                    arg.substring("--max-rollback-blocks=".length()), "--max-rollback-blocks");
                        } else if (arg.startsWith("--lock-timeout-ms=")) {
                            lockTimeoutMillis = parsePositiveLong(
                                    arg.substring("--lock-timeout-ms=".length()), "--lock-timeout-ms");
                        } else if (arg.startsWith("--log-level=")) {
                            logLevel = arg.substring("--log-level=".length());
                        } else if (error == null) {
                            showHelp = true;
                            error = "Unknown option: " + arg;
                        }
                    } catch (IllegalArgumentException ex) {
                        showHelp = true;
                        if (error == null) {
                            error = ex.getMessage();
                        }
                    }
                }
            }

            try {
                logLevel = Level.parse(logLevel.trim().toUpperCase(Locale.ROOT)).getName();
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                if (error == null) {
                    error = "Invalid value for --log-level: " + logLevel;
                }
            }
            if (apiToken != null && apiToken.isBlank()) {
                apiToken = null;
            }

            return new CliOptions(
                    showHelp,
                    error,
                    dataDir,
                    inMemory,
                    reset,
                    apiBind,
                    apiPort,
                    apiToken,
                    maxRollbackBlocks,
                    lockTimeoutMillis,
                    logLevel
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: utxo-ledger [options]

Options:
  --help, -h                   Show this help message and exit
  --data-dir=<path>            Path for ledger data (default ./data/ledger)
  --in-memory                  Keep the ledger in memory instead of RocksDB
  --reset-ledger               Delete ledger data before starting
  --api-bind=<host>            Bind address for the REST API (default 0.0.0.0)
  --api-port=<port>            Port for the REST API (default 3000)
  --api-token=<token>          Require Bearer/X-API-Key token for the REST API
  --max-rollback-blocks=<n>    Deepest rollback accepted, in blocks (default 2000)
  --lock-timeout-ms=<ms>       How long a write waits for store locks (default 5000)
  --log-level=<level>          java.util.logging level for the root logger (default INFO)

Environment overrides:
  UTXO_LEDGER_DATA_DIR             Default for --data-dir
  UTXO_LEDGER_STORE                Set to "memory" to use the in-memory store
  UTXO_LEDGER_API_BIND             Default for --api-bind
  UTXO_LEDGER_API_PORT             Default for --api-port
  UTXO_LEDGER_API_TOKEN            Token for REST API auth (if --api-token not supplied)
  UTXO_LEDGER_MAX_ROLLBACK_BLOCKS  Default for --max-rollback-blocks
  UTXO_LEDGER_LOCK_TIMEOUT_MS      Default for --lock-timeout-ms
  UTXO_LEDGER_LOG_LEVEL            Default for --log-level
""");
        }

        private static String envOrDefault(Function<String, String> env, String key, String fallback) {
            String value = env.apply(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value.trim());
                if (port < 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }

        private static long parseNonNegativeLong(String value, String flag) {
            try {
                long parsed = Long.parseLong(value.trim());
                if (parsed < 0) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }

        private static long parsePositiveLong(String value, String flag) {
            long parsed = parseNonNegativeLong(value, flag);
            if (parsed == 0) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
            return parsed;
        }
    }
}
