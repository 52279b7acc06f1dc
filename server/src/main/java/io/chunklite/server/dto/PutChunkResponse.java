// file: server/src/main/java/io/chunklite/server/dto/PutChunkResponse.java
package io.chunklite.server.dto;

/**
 * JSON response for PUT /chunks.
 *   {
 *     "address": "2cf24dba...",
 *     "stored": true
 *   }
 * {@code stored} is false when the chunk was already present.
 */
public class PutChunkResponse {
    public String address;
    public boolean stored;
}
