package io.chunklite.server.dto;

import java.util.List;

public class PeerListJson {
    public List<PeerJson> peers;

    public static class PeerJson {
        public String nodeId;
        public String baseUrl;
    }
}
