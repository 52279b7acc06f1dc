// file: src/main/java/io/chunklite/storage/ChunkStore.java
package io.chunklite.storage;

import io.chunklite.core.Address;
import io.chunklite.core.Chunk;

/**
 * Local durable chunk store used underneath NetStore.
 * <p>
 * Semantics:
 *  - get() returns the stored chunk, or null if the address is absent.
 *  - put() returns null when the chunk was already present (nothing to wait for),
 *    or a {@link DurabilityWait} when the chunk was newly written and its
 *    durability is still pending.
 *  - Failures surface as {@link ChunkStoreException}.
 */
public interface ChunkStore extends AutoCloseable {

    /** Look up a chunk by address; null when not stored. */
    Chunk get(Address address);

    /**
     * Write a chunk.
     *
     * @return null if already present, otherwise a wait for the write to become durable
     */
    DurabilityWait put(Chunk chunk);

    /** Release files and background workers. */
    @Override
    void close();
}
