package io.taulite.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.taulite.server.dto.JsonConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Server configuration parsed from CLI args, optionally layered over a JSON file.
 *
 * Supports:
 *  - port:             HTTP API port
 *  - dataDir:          root directory for WAL segments and snapshots
 *  - backend:          record store implementation (memory | durable)
 *  - catalogCapacity:  maximum number of series, groups and lenses (each)
 *  - snapshotEvery:    durable store writes between full snapshots
 *  - maxPayloadBytes:  largest accepted request body
 */
public record ServerConfig(
        int port,
        Path dataDir,
        Backend backend,
        int catalogCapacity,
        int snapshotEvery,
        int maxPayloadBytes
) {
    public static final int DEFAULT_PORT = 7701;
    public static final String DEFAULT_DATA_DIR = "./data";
    public static final int DEFAULT_CATALOG_CAPACITY = 10_000;
    public static final int DEFAULT_SNAPSHOT_EVERY = 50_000;
    public static final int DEFAULT_MAX_PAYLOAD_BYTES = 1024 * 1024;

    public enum Backend {
        MEMORY, DURABLE;

        static Backend parse(String s) {
            return switch (s.toLowerCase(Locale.ROOT)) {
                case "memory" -> MEMORY;
                case "durable" -> DURABLE;
                default -> throw new IllegalArgumentException("backend must be memory or durable, got: " + s);
            };
        }
    }

    public ServerConfig {
        if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
        if (catalogCapacity <= 0) throw new IllegalArgumentException("catalog-capacity must be > 0");
        if (snapshotEvery <= 0) throw new IllegalArgumentException("snapshot-every must be > 0");
        if (maxPayloadBytes <= 0) throw new IllegalArgumentException("max-payload-bytes must be > 0");
        if (dataDir == null) throw new IllegalArgumentException("data-dir must be set");
        if (backend == null) throw new IllegalArgumentException("backend must be set");
    }

    public static ServerConfig defaults() {
        return fromArgs(new String[0]);
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --port,              -p  <port>
     *   --data-dir,          -d  <path>
     *   --backend,           -b  memory|durable
     *   --catalog-capacity       <n>
     *   --snapshot-every         <n>
     *   --max-payload-bytes      <n>
     *   --config,            -c  <json file>
     *
     * Flags win over values from --config regardless of their order.
     * --help is handled by {@link Main}.
     *
     * @throws IllegalArgumentException on unknown flags, missing or malformed values
     */
    public static ServerConfig fromArgs(String[] args) {
        Integer port = null;
        String dataDir = null;
        String backend = null;
        Integer capacity = null;
        Integer snapshotEvery = null;
        Integer maxPayload = null;
        String configPath = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--port", "-p" -> port = intValue(args, ++i, "--port");
                case "--data-dir", "-d" -> dataDir = value(args, ++i, "--data-dir");
                case "--backend", "-b" -> backend = value(args, ++i, "--backend");
                case "--catalog-capacity" -> capacity = intValue(args, ++i, "--catalog-capacity");
                case "--snapshot-every" -> snapshotEvery = intValue(args, ++i, "--snapshot-every");
                case "--max-payload-bytes" -> maxPayload = intValue(args, ++i, "--max-payload-bytes");
                case "--config", "-c" -> configPath = value(args, ++i, "--config");
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        JsonConfig file = configPath == null ? new JsonConfig() : loadJson(Path.of(configPath));
        return new ServerConfig(
                first(port, file.port, DEFAULT_PORT),
                Path.of(first(dataDir, file.dataDir, DEFAULT_DATA_DIR)),
                Backend.parse(first(backend, file.backend, "durable")),
                first(capacity, file.catalogCapacity, DEFAULT_CATALOG_CAPACITY),
                first(snapshotEvery, file.snapshotEvery, DEFAULT_SNAPSHOT_EVERY),
                first(maxPayload, file.maxPayloadBytes, DEFAULT_MAX_PAYLOAD_BYTES)
        );
    }

    static JsonConfig loadJson(Path path) {
        try {
            return new ObjectMapper().readValue(path.toFile(), JsonConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load config from " + path, e);
        }
    }

    public static boolean wantsHelp(String[] args) {
        for (String a : args) {
            if (a.equals("--help") || a.equals("-h")) return true;
        }
        return false;
    }

    public static String usage() {
        return """
            Usage: taulite-server [options]

            Options:
              --port,              -p   HTTP port (default: 7701)
              --data-dir,          -d   Data directory (default: ./data)
              --backend,           -b   memory | durable (default: durable)
              --catalog-capacity        Max series/groups/lenses each (default: 10000)
              --snapshot-every          Writes between snapshots (default: 50000)
              --max-payload-bytes       Max request body size (default: 1048576)
              --config,            -c   JSON file with the same settings
              --help,              -h   Show this help message
            """;
    }

    private static String value(String[] args, int i, String flag) {
        if (i >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + flag);
        }
        return args[i];
    }

    private static int intValue(String[] args, int i, String flag) {
        String raw = value(args, i, flag);
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + flag + ": " + raw, e);
        }
    }

    @SafeVarargs
    private static <T> T first(T... candidates) {
        for (T c : candidates) {
            if (c != null) return c;
        }
        throw new IllegalStateException("no default");
    }
}
