// file: server/src/main/java/io/chunklite/server/dto/PutChunkRequest.java
package io.chunklite.server.dto;

/**
 * JSON body for PUT /chunks.
 * Example:
 *   {
 *     "dataBase64": "aGVsbG8="
 *   }
 * The address is derived from the content, so the client never sends one.
 */
public class PutChunkRequest {
    public String dataBase64;
}
