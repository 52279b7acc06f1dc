// file: server/src/main/java/io/chunklite/server/ServerConfig.java
package io.chunklite.server;

import io.chunklite.storage.net.NetStore;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-node server configuration parsed from CLI args.
 *
 * Supports:
 *  - nodeId:           identity sent to peers as the requester of a fetch
 *  - httpPort:         HTTP API port (clients and peers)
 *  - dataDir:          root directory; WAL segments live in {dataDir}/wal
 *  - sessionCapacity:  bound on tracked fetch sessions
 *  - segmentBytes:     WAL segment rotation threshold
 *  - flushIntervalMs:  group-commit fsync interval
 *  - requestTimeoutMs: default deadline for GET /chunks/{hex} and PUT durability
 *  - peerTimeoutMs:    per-request timeout towards a peer
 *  - peers:            "nodeId=baseUrl" entries from repeated --peer flags
 *  - peersConfigPath:  optional JSON peer list
 */
public record ServerConfig(
        String nodeId,
        int httpPort,
        String dataDir,
        int sessionCapacity,
        long segmentBytes,
        long flushIntervalMs,
        long requestTimeoutMs,
        long peerTimeoutMs,
        List<String> peers,
        String peersConfigPath
) {

    public ServerConfig {
        peers = List.copyOf(peers);
    }

    /**
     * Parse flags, printing usage and exiting on --help or on an invalid flag.
     *
     * Supported flags:
     *   --node-id,   -n   <id>
     *   --http-port, -p   <port>
     *   --data-dir,  -d   <path>
     *   --session-capacity <n>
     *   --segment-bytes    <bytes>
     *   --flush-interval-ms  <ms>
     *   --request-timeout-ms <ms>
     *   --peer-timeout-ms    <ms>
     *   --peer             <nodeId=baseUrl>   (repeatable)
     *   --peers-config, -c <path>
     *   --help,      -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        for (String a : args) {
            if ("--help".equals(a) || "-h".equals(a)) {
                printHelpAndExit();
            }
        }
        try {
            return parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.exit(1);
            throw e;
        }
    }

    /**
     * Same flags as {@link #fromArgs}, but reports problems as
     * {@link IllegalArgumentException} instead of exiting.
     */
    public static ServerConfig parse(String[] args) {
        // Defaults
        String nodeId = "node-a";
        int httpPort = 8080;
        String dataDir = "./data";
        int sessionCapacity = NetStore.DEFAULT_SESSION_TABLE_CAPACITY;
        long segmentBytes = 64L * 1024 * 1024;
        long flushIntervalMs = 10;
        long requestTimeoutMs = 10_000;
        long peerTimeoutMs = 2_000;
        List<String> peers = new ArrayList<>();
        String peersConfigPath = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--node-id", "-n" -> nodeId = value(args, i++);
                case "--http-port", "-p" -> httpPort = (int) number(args, i++, 1, 65535);
                case "--data-dir", "-d" -> dataDir = value(args, i++);
                case "--session-capacity" -> sessionCapacity = (int) number(args, i++, 1, Integer.MAX_VALUE);
                case "--segment-bytes" -> segmentBytes = number(args, i++, 1, Long.MAX_VALUE);
                case "--flush-interval-ms" -> flushIntervalMs = number(args, i++, 1, Long.MAX_VALUE);
                case "--request-timeout-ms" -> requestTimeoutMs = number(args, i++, 1, Long.MAX_VALUE);
                case "--peer-timeout-ms" -> peerTimeoutMs = number(args, i++, 1, Long.MAX_VALUE);
                case "--peer" -> peers.add(value(args, i++));
                case "--peers-config", "-c" -> peersConfigPath = value(args, i++);
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        if (nodeId.isBlank()) {
            throw new IllegalArgumentException("node-id must not be blank");
        }
        return new ServerConfig(
                nodeId,
                httpPort,
                dataDir,
                sessionCapacity,
                segmentBytes,
                flushIntervalMs,
                requestTimeoutMs,
                peerTimeoutMs,
                peers,
                peersConfigPath
        );
    }

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
        return args[i + 1];
    }

    private static long number(String[] args, int i, long min, long max) {
        String raw = value(args, i);
        long n;
        try {
            n = Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + args[i].replaceFirst("^-+", "") + ": " + raw);
        }
        if (n < min || n > max) {
            throw new IllegalArgumentException(
                    args[i].replaceFirst("^-+", "") + " must be in [" + min + ", " + max + "], got " + n);
        }
        return n;
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: server [options]

            Options:
              --node-id,       -n   Node identifier (default: node-a)
              --http-port,     -p   HTTP port (default: 8080)
              --data-dir,      -d   Data directory, WAL in <dir>/wal (default: ./data)
              --session-capacity    Max tracked fetch sessions (default: 5000)
              --segment-bytes       WAL segment size before rotation (default: 64 MiB)
              --flush-interval-ms   Group-commit fsync interval (default: 10)
              --request-timeout-ms  Default request deadline (default: 10000)
              --peer-timeout-ms     Timeout for one peer request (default: 2000)
              --peer                Peer as nodeId=baseUrl, repeatable
              --peers-config,  -c   Path to JSON peer list (optional)
              --help,          -h   Show this help message
            """);
        System.exit(0);
    }
}
