// file: server/src/main/java/io/chunklite/server/peer/PeerConfig.java
package io.chunklite.server.peer;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.chunklite.server.dto.PeerListJson;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Static list of peers this node may ask for missing chunks.
 * <p>
 * JSON layout:
 * <pre>
 *   {
 *     "peers": [
 *       { "nodeId": "node-b", "baseUrl": "http://localhost:8081" }
 *     ]
 *   }
 * </pre>
 */
public final class PeerConfig {

    public record Peer(String nodeId, URI baseUri) {
        public Peer {
            Objects.requireNonNull(nodeId, "nodeId");
            Objects.requireNonNull(baseUri, "baseUri");
            if (nodeId.isBlank()) throw new IllegalArgumentException("nodeId must not be blank");
            String scheme = baseUri.getScheme();
            if (!"http".equals(scheme) && !"https".equals(scheme)) {
                throw new IllegalArgumentException("peer " + nodeId + " needs an http(s) base URL, got " + baseUri);
            }
        }
    }

    private final List<Peer> peers;

    public PeerConfig(List<Peer> peers) {
        Set<String> seen = new HashSet<>();
        for (Peer p : peers) {
            if (!seen.add(p.nodeId())) {
                throw new IllegalArgumentException("duplicate peer nodeId " + p.nodeId());
            }
        }
        this.peers = List.copyOf(peers);
    }

    public static PeerConfig empty() {
        return new PeerConfig(List.of());
    }

    public static PeerConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        PeerListJson cfg;
        try {
            cfg = mapper.readValue(path.toFile(), PeerListJson.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load PeerConfig from " + path, e);
        }
        List<Peer> list = new ArrayList<>();
        if (cfg.peers != null) {
            for (PeerListJson.PeerJson p : cfg.peers) {
                if (p.baseUrl == null) {
                    throw new IllegalArgumentException("peer " + p.nodeId + " in " + path + " has no baseUrl");
                }
                list.add(new Peer(p.nodeId, URI.create(p.baseUrl)));
            }
        }
        return new PeerConfig(list);
    }

    /** Parse repeated "nodeId=baseUrl" flag values. */
    public static PeerConfig fromFlags(List<String> specs) {
        List<Peer> list = new ArrayList<>(specs.size());
        for (String spec : specs) {
            int eq = spec.indexOf('=');
            if (eq <= 0 || eq == spec.length() - 1) {
                throw new IllegalArgumentException("peer must look like nodeId=baseUrl, got: " + spec);
            }
            list.add(new Peer(spec.substring(0, eq), URI.create(spec.substring(eq + 1))));
        }
        return new PeerConfig(list);
    }

    /** Peers of both configs; a nodeId present in both is rejected. */
    public PeerConfig plus(PeerConfig other) {
        List<Peer> all = new ArrayList<>(peers);
        all.addAll(other.peers);
        return new PeerConfig(all);
    }

    public List<Peer> peers() {
        return peers;
    }
}
