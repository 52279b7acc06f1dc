// file: server/src/main/java/io/chunklite/server/WebServer.java
package io.chunklite.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chunklite.core.Address;
import io.chunklite.core.Chunk;
import io.chunklite.core.FetchContext;
import io.chunklite.server.dto.ChunkResponse;
import io.chunklite.server.dto.PutChunkRequest;
import io.chunklite.server.dto.PutChunkResponse;
import io.chunklite.storage.ChunkStoreException;
import io.chunklite.storage.DurabilityWait;
import io.chunklite.storage.net.NetStore;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Thin HTTP adapter over NetStore.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Turn request headers into a per-request FetchContext.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - PUT /chunks                     store a chunk, wait for durability
 *   - GET /chunks/{hex}               local or network retrieval
 *   - GET /chunks/{hex}?local=true    local only, 404 on miss (used by peers)
 *   - GET /admin/health               basic health check
 *   - GET /admin/sessions             number of tracked fetch sessions
 *
 * GET headers:
 *   - X-Chunk-Timeout-Ms: deadline for this request (default from config)
 *   - X-Chunk-Requester:  identity of the asking party, recorded on the session
 *
 * Retrieval blocks, so every request is dispatched from the IO thread to a
 * worker thread before it is handled.
 */
public final class WebServer {
    static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB
    static final String TIMEOUT_HEADER = "X-Chunk-Timeout-Ms";
    static final String REQUESTER_HEADER = "X-Chunk-Requester";

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final String nodeId;
    private final NetStore net;
    private final Duration defaultTimeout;

    public WebServer(int port, String nodeId, NetStore net, Duration defaultTimeout) {
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
        this.net = Objects.requireNonNull(net, "net");
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "defaultTimeout");

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(this::handle)
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    private void handle(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::handle);
            return;
        }
        exchange.startBlocking();

        var path = exchange.getRequestPath();
        var method = exchange.getRequestMethod().toString();
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        RequestLogger access = RequestLogger.start(method, path).requester(requester(exchange));

        if ("/chunks".equals(path) || "/chunks/".equals(path)) {
            if ("PUT".equals(method)) {
                handlePut(exchange, access);
            } else {
                reject(exchange, access, 405, "method not allowed");
            }
        } else if (path.startsWith("/chunks/")) {
            String hex = path.substring("/chunks/".length());
            if ("GET".equals(method)) {
                handleGet(exchange, hex, access);
            } else {
                reject(exchange, access, 405, "method not allowed");
            }
        } else if ("/admin/health".equals(path)) {
            send(exchange, 200, Map.of("status", "ok", "nodeId", nodeId));
            access.finish(200, null);
        } else if ("/admin/sessions".equals(path)) {
            send(exchange, 200, Map.of("activeSessions", net.activeSessions()));
            access.finish(200, null);
        } else {
            reject(exchange, access, 404, "not found");
        }
    }

    // ---------- handlers ----------

    /** PUT /chunks */
    private void handlePut(HttpServerExchange ex, RequestLogger access) {
        Throwable error = null;
        try {
            byte[] body = ex.getInputStream().readNBytes(MAX_BODY_BYTES + 1);
            if (body.length > MAX_BODY_BYTES) {
                send(ex, 413, Map.of("error", "request body too large"));
            } else {
                var req = json.readValue(body, PutChunkRequest.class);
                if (req == null || req.dataBase64 == null) {
                    throw new IllegalArgumentException("dataBase64 is required");
                }
                Chunk chunk = Chunk.of(Base64.getDecoder().decode(req.dataBase64));

                access.storeStarted();
                DurabilityWait wait = net.put(chunk);
                if (wait != null) {
                    wait.await(FetchContext.timeout(defaultTimeout));
                }
                access.storeFinished();

                var dto = new PutChunkResponse();
                dto.address = chunk.address().hex();
                dto.stored = wait != null;
                send(ex, 200, dto);
            }
        } catch (JsonProcessingException jsonEx) {
            error = jsonEx;
            send(ex, 400, Map.of("error", "invalid JSON"));
        } catch (IllegalArgumentException bad) {
            error = bad;
            send(ex, 400, Map.of("error", bad.getMessage()));
        } catch (TimeoutException slow) {
            error = slow;
            send(ex, 504, Map.of("error", "write not durable before deadline"));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            error = ie;
            send(ex, 500, Map.of("error", "interrupted"));
        } catch (IOException | ChunkStoreException | IllegalStateException e) {
            error = e;
            send(ex, 500, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        } finally {
            access.finish(ex.getStatusCode(), error);
        }
    }

    /** GET /chunks/{hex}, optionally ?local=true */
    private void handleGet(HttpServerExchange ex, String hex, RequestLogger access) {
        int status = 200;
        Throwable error = null;
        try {
            Address address = Address.fromHex(hex);
            boolean localOnly = Boolean.parseBoolean(firstOrNull(ex.getQueryParameters().get("local")));
            access.localOnly(localOnly);

            access.storeStarted();
            Chunk chunk;
            if (localOnly) {
                chunk = net.getLocal(address);
            } else {
                FetchContext ctx = FetchContext.timeout(requestTimeout(ex));
                chunk = net.get(ctx, address, requester(ex));
            }
            access.storeFinished();

            if (chunk == null) {
                status = 404;
                send(ex, status, Map.of("error", "chunk not stored locally"));
            } else {
                var dto = new ChunkResponse();
                dto.address = chunk.address().hex();
                dto.dataBase64 = Base64.getEncoder().encodeToString(chunk.data());
                send(ex, status, dto);
            }
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", bad.getMessage()));
        } catch (TimeoutException slow) {
            status = 504;
            error = slow;
            send(ex, status, Map.of("error", "chunk not retrieved before deadline"));
        } catch (CancellationException cancelled) {
            status = 503;
            error = cancelled;
            send(ex, status, Map.of("error", "retrieval cancelled"));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            status = 500;
            error = ie;
            send(ex, status, Map.of("error", "interrupted"));
        } catch (ChunkStoreException | IllegalStateException e) {
            status = 500;
            error = e;
            send(ex, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        } finally {
            access.finish(status, error);
        }
    }

    // ---------- header parsing ----------

    /**
     * Deadline from X-Chunk-Timeout-Ms, or the configured default.
     * Invalid values surface as IllegalArgumentException (HTTP 400).
     */
    private Duration requestTimeout(HttpServerExchange ex) {
        String raw = ex.getRequestHeaders().getFirst(TIMEOUT_HEADER);
        if (raw == null || raw.isBlank()) {
            return defaultTimeout;
        }
        long ms;
        try {
            ms = Long.parseLong(raw.trim());
        } catch (NumberFormatException nfe) {
            throw new IllegalArgumentException(TIMEOUT_HEADER + " must be a long", nfe);
        }
        if (ms <= 0) {
            throw new IllegalArgumentException(TIMEOUT_HEADER + " must be > 0");
        }
        return Duration.ofMillis(ms);
    }

    private static String requester(HttpServerExchange ex) {
        String raw = ex.getRequestHeaders().getFirst(REQUESTER_HEADER);
        return raw == null || raw.isBlank() ? null : raw.trim();
    }

    // ---------- helpers ----------

    private void reject(HttpServerExchange ex, RequestLogger access, int status, String message) {
        send(ex, status, Map.of("error", message));
        access.finish(status, null);
    }

    private static String firstOrNull(Deque<String> deque) {
        return (deque == null || deque.isEmpty()) ? null : deque.getFirst();
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
