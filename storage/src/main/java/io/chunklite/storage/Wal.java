// file: src/main/java/io/chunklite/storage/Wal.java
package io.chunklite.storage;

/**
 * Append-only log of chunk records, split into numbered segments.
 * <p>
 * Contract:
 *  - append() writes one framed record but does NOT fsync; the record is
 *    readable immediately and durable once a later sync() covers its position.
 *  - Positions are logical byte offsets across all segments, monotonically
 *    increasing; sync() returns the highest position known to be durable.
 *  - A record is atomic at recovery time: a partial write is treated as absent.
 */
public interface Wal extends AutoCloseable {

    /** Where a record's payload lives, and the logical end position of the record. */
    record Location(int segment, long offset, int length, long endPosition) {}

    /**
     * Append a single framed record (header + payload) without forcing it.
     *
     * @param serializedRecord bytes from RecordCodec.encode(...)
     */
    Location append(byte[] serializedRecord);

    /** fsync everything appended so far; returns the durable logical position. */
    long sync();

    /** Highest logical position that a previous sync() made durable. */
    long syncedPosition();

    /** Read back a record payload (header excluded), validating its CRC. */
    byte[] read(Location location);

    /** Start a new segment once the current one exceeds the configured size. */
    void rotateIfNeeded();

    /**
     * Sequential reader over all segments, oldest first. Stops at the end of
     * the newest segment; a corrupt record ends the scan of its segment.
     */
    WalReader openReader();

    @Override
    void close();

    interface WalReader extends AutoCloseable {

        /** @return next valid entry, or null at the end of the log */
        Entry next();

        @Override
        void close();
    }

    /** One replayed record. */
    record Entry(byte[] payload, Location location) {}
}
