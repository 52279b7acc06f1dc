package io.chunklite.storage;

/**
 * Local store failure (I/O error, corrupt record, store closed).
 * Surfaced to the immediate caller unchanged; nothing in this layer retries.
 */
public class ChunkStoreException extends RuntimeException {

    public ChunkStoreException(String message) {
        super(message);
    }

    public ChunkStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
