// file: server/src/main/java/io/chunklite/server/dto/ChunkResponse.java
package io.chunklite.server.dto;

/**
 * JSON response for GET /chunks/{hex}, also consumed by peers.
 *   {
 *     "address": "2cf24dba...",
 *     "dataBase64": "aGVsbG8="
 *   }
 */
public class ChunkResponse {
    public String address;
    public String dataBase64;
}
