// file: server/src/main/java/io/chunklite/server/peer/HttpPeerFetchers.java
package io.chunklite.server.peer;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.chunklite.core.Address;
import io.chunklite.core.Chunk;
import io.chunklite.core.FetchContext;
import io.chunklite.server.dto.ChunkResponse;
import io.chunklite.storage.net.RemoteFetcher;
import io.chunklite.storage.net.RemoteFetcherFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * RemoteFetcherFactory that asks peer nodes over HTTP.
 * <p>
 * Talks to each peer's local-only endpoint:
 * <pre>
 *   GET {baseUrl}/chunks/{hex}?local=true
 *   X-Chunk-Requester: {this node's id}
 * </pre>
 * Behaviour per fetch session:
 *  - every waiter's request asks the next peer not asked yet, skipping the
 *    requesting node itself, so interest fans out one peer at a time;
 *  - a 200 response is turned into a chunk and handed to {@code sink}
 *    (NetStore.put), which delivers it to the session;
 *  - a failed call, a 404 or unusable content is logged at FINE and the
 *    same request moves on to the next untried peer, until one answers or
 *    the peer list is exhausted;
 *  - cancelling the session lifetime aborts in-flight requests and stops
 *    further attempts.
 */
public final class HttpPeerFetchers implements RemoteFetcherFactory {
    private static final Logger log = Logger.getLogger(HttpPeerFetchers.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String REQUESTER_HEADER = "X-Chunk-Requester";

    private final String localNodeId;
    private final List<PeerConfig.Peer> peers;
    private final Duration peerTimeout;
    private final Consumer<Chunk> sink;
    private final HttpClient client;

    /**
     * @param localNodeId this node; never asked, and sent as the requester to peers
     * @param peers       candidate peers in the order they are tried
     * @param peerTimeout timeout for a single peer request
     * @param sink        receives fetched chunks; expected to be NetStore.put
     */
    public HttpPeerFetchers(String localNodeId, PeerConfig peers, Duration peerTimeout, Consumer<Chunk> sink) {
        this.localNodeId = Objects.requireNonNull(localNodeId, "localNodeId");
        this.peers = peers.peers().stream()
                .filter(p -> !p.nodeId().equals(localNodeId))
                .toList();
        this.peerTimeout = Objects.requireNonNull(peerTimeout, "peerTimeout");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.client = HttpClient.newBuilder()
                .connectTimeout(peerTimeout)
                .build();
    }

    @Override
    public RemoteFetcher create(FetchContext lifetime, Address address, Set<String> requesters) {
        return new PeerFetch(lifetime, address, requesters);
    }

    /** Peers that will be tried, in order. */
    public List<PeerConfig.Peer> peers() {
        return peers;
    }

    private final class PeerFetch implements RemoteFetcher {
        private final FetchContext lifetime;
        private final Address address;
        private final Set<String> requesters;
        private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();
        private int nextPeer;

        PeerFetch(FetchContext lifetime, Address address, Set<String> requesters) {
            this.lifetime = lifetime;
            this.address = address;
            this.requesters = requesters;
            lifetime.onCancel(this::abort);
        }

        @Override
        public void request(String requester, FetchContext ctx) {
            askNextPeer(requester);
        }

        private void askNextPeer(String requester) {
            if (lifetime.isDone()) {
                return;
            }
            PeerConfig.Peer peer = nextPeer(requester);
            if (peer == null) {
                log.fine(() -> "no untried peer left for " + address + " (waiting: " + requesters + ")");
                return;
            }

            URI uri = peer.baseUri().resolve("/chunks/" + address.hex() + "?local=true");
            HttpRequest req = HttpRequest.newBuilder(uri)
                    .timeout(peerTimeout)
                    .header(REQUESTER_HEADER, localNodeId)
                    .GET()
                    .build();

            CompletableFuture<HttpResponse<byte[]>> call =
                    client.sendAsync(req, HttpResponse.BodyHandlers.ofByteArray());
            inFlight.add(call);
            call.whenComplete((resp, err) -> {
                inFlight.remove(call);
                if (err != null) {
                    log.log(Level.FINE, "peer " + peer.nodeId() + " failed for " + address, err);
                    askNextPeer(requester);
                } else if (!accept(peer, resp)) {
                    askNextPeer(requester);
                }
            });
            if (lifetime.isCancelled()) {
                call.cancel(true);
            }
        }

        private synchronized PeerConfig.Peer nextPeer(String requester) {
            while (nextPeer < peers.size()) {
                PeerConfig.Peer p = peers.get(nextPeer++);
                if (!p.nodeId().equals(requester)) {
                    return p;
                }
            }
            return null;
        }

        /** @return true once the peer's chunk was handed to the sink, or the session no longer needs it */
        private boolean accept(PeerConfig.Peer peer, HttpResponse<byte[]> resp) {
            if (resp.statusCode() != 200) {
                log.fine(() -> "peer " + peer.nodeId() + " returned HTTP " + resp.statusCode() + " for " + address);
                return false;
            }
            if (lifetime.isCancelled()) {
                return true;
            }
            try {
                ChunkResponse dto = MAPPER.readValue(resp.body(), ChunkResponse.class);
                Chunk chunk = Chunk.of(Base64.getDecoder().decode(dto.dataBase64));
                if (!chunk.address().equals(address)) {
                    log.fine(() -> "peer " + peer.nodeId() + " returned content for " + chunk.address()
                            + " when asked for " + address);
                    return false;
                }
                sink.accept(chunk);
                log.fine(() -> "fetched " + address + " from peer " + peer.nodeId());
                return true;
            } catch (IOException | RuntimeException e) {
                log.log(Level.FINE, "could not store chunk " + address + " from peer " + peer.nodeId(), e);
                return false;
            }
        }

        private void abort() {
            for (CompletableFuture<?> call : inFlight) {
                call.cancel(true);
            }
            inFlight.clear();
        }
    }
}
