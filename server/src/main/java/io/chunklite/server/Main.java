// file: server/src/main/java/io/chunklite/server/Main.java
package io.chunklite.server;

import io.chunklite.server.peer.HttpPeerFetchers;
import io.chunklite.server.peer.PeerConfig;
import io.chunklite.storage.DurableChunkStore;
import io.chunklite.storage.FileWal;
import io.chunklite.storage.net.NetStore;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for a single chunk node.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Load logging configuration.
 *  - Wire storage (WAL, DurableChunkStore), peer fetchers and NetStore.
 *  - Start the HTTP server and stop everything on shutdown.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws IOException {
        var cfg = ServerConfig.fromArgs(args);
        configureLogging();

        // ------ Storage layer ------
        var wal = new FileWal(Path.of(cfg.dataDir()).resolve("wal"), cfg.segmentBytes());
        var store = new DurableChunkStore(wal, Duration.ofMillis(cfg.flushIntervalMs()));

        // ------ Peers + retrieval coordination ------
        // Fetched chunks go back through NetStore.put, which only exists once the fetchers do.
        PeerConfig peers = buildPeerConfig(cfg);
        AtomicReference<NetStore> netRef = new AtomicReference<>();
        var fetchers = new HttpPeerFetchers(
                cfg.nodeId(),
                peers,
                Duration.ofMillis(cfg.peerTimeoutMs()),
                chunk -> netRef.get().put(chunk)
        );
        var net = new NetStore(store, fetchers, cfg.sessionCapacity());
        netRef.set(net);

        // ------ HTTP layer ------
        var web = new WebServer(cfg.httpPort(), cfg.nodeId(), net, Duration.ofMillis(cfg.requestTimeoutMs()));
        web.start();

        log.info(() -> String.format("Node %s listening on http://localhost:%d with %d peer(s), data in %s",
                cfg.nodeId(), cfg.httpPort(), fetchers.peers().size(), cfg.dataDir()));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                web.stop();
            } finally {
                try {
                    net.close();
                } catch (RuntimeException e) {
                    log.log(Level.WARNING, "failed to close chunk store cleanly", e);
                }
            }
        }, "chunk-node-shutdown"));
    }

    private static PeerConfig buildPeerConfig(ServerConfig cfg) {
        PeerConfig fromFile = cfg.peersConfigPath() != null && !cfg.peersConfigPath().isBlank()
                ? PeerConfig.fromJsonFile(Path.of(cfg.peersConfigPath()))
                : PeerConfig.empty();
        return fromFile.plus(PeerConfig.fromFlags(cfg.peers()));
    }

    /** Bundled console logging, unless a config file was given with -Djava.util.logging.config.file. */
    private static void configureLogging() throws IOException {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        }
    }
}
