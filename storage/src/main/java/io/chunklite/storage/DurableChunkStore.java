// file: src/main/java/io/chunklite/storage/DurableChunkStore.java
package io.chunklite.storage;

import io.chunklite.core.Address;
import io.chunklite.core.Chunk;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable, append-only chunk store.
 * <p>
 * Responsibilities:
 *  - Maintain an in-memory index: address -> WAL location of the record.
 *  - On put:
 *      1) If the address is already indexed, return null (already present).
 *      2) Append the framed record to the WAL (no fsync yet) and index it.
 *      3) Register a pending durability future keyed by the record's end position.
 *      4) Rotate the WAL segment if needed.
 *  - A background flusher fsyncs the WAL every {@code flushInterval} and
 *    completes every pending future whose record the sync covered (group commit).
 *  - On get: read the record back from its segment and decode it.
 * <p>
 *  - On startup: replay every WAL segment into the index.
 * <p>
 * Chunks are immutable, so there is nothing to merge or snapshot: the index
 * is rebuilt from the log alone.
 */
public class DurableChunkStore implements ChunkStore {
    private static final Logger log = Logger.getLogger(DurableChunkStore.class.getName());

    private final Wal wal;
    private final Map<Address, Wal.Location> index = new ConcurrentHashMap<>();
    private final ConcurrentNavigableMap<Long, CompletableFuture<Void>> pending = new ConcurrentSkipListMap<>();
    private final ScheduledExecutorService flusher;
    private volatile boolean closed;

    public DurableChunkStore(Wal wal, Duration flushInterval) {
        this.wal = Objects.requireNonNull(wal, "wal");
        Objects.requireNonNull(flushInterval, "flushInterval");
        if (flushInterval.isNegative() || flushInterval.isZero()) {
            throw new IllegalArgumentException("flushInterval must be positive, got: " + flushInterval);
        }
        recover();
        this.flusher = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "chunk-wal-flusher");
            t.setDaemon(true);
            return t;
        });
        long micros = flushInterval.toNanos() / 1_000L;
        flusher.scheduleWithFixedDelay(this::flushSafely, micros, Math.max(micros, 1L), TimeUnit.MICROSECONDS);
    }

    @Override
    public Chunk get(Address address) {
        Objects.requireNonNull(address, "address");
        ensureOpen();
        Wal.Location loc = index.get(address);
        if (loc == null) {
            return null;
        }
        return RecordCodec.decode(wal.read(loc));
    }

    @Override
    public synchronized DurabilityWait put(Chunk chunk) {
        Objects.requireNonNull(chunk, "chunk");
        ensureOpen();
        if (index.containsKey(chunk.address())) {
            return null;
        }

        // 1) append without fsync; readable right away
        Wal.Location loc = wal.append(RecordCodec.encode(chunk));
        index.put(chunk.address(), loc);

        // 2) durability is granted by the next sync covering endPosition
        CompletableFuture<Void> durable = new CompletableFuture<>();
        pending.put(loc.endPosition(), durable);
        // The flusher may have synced between append and registration.
        if (wal.syncedPosition() >= loc.endPosition()) {
            completeUpTo(wal.syncedPosition());
        }

        // 3) maybe rotate (rotation forces the old segment)
        wal.rotateIfNeeded();
        if (wal.syncedPosition() >= loc.endPosition()) {
            completeUpTo(wal.syncedPosition());
        }

        return ctx -> ctx.await(durable);
    }

    /** Number of distinct chunks indexed. */
    public int size() {
        return index.size();
    }

    /** Force everything appended so far and release its waiters. */
    public void flush() {
        ensureOpen();
        completeUpTo(wal.sync());
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) return;
            closed = true;
        }
        flusher.shutdown();
        try {
            flusher.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        try {
            completeUpTo(wal.sync());
        } catch (ChunkStoreException e) {
            failPending(e);
            throw e;
        } finally {
            failPending(new ChunkStoreException("store closed before write became durable"));
            wal.close();
        }
    }

    private void ensureOpen() {
        if (closed) throw new ChunkStoreException("chunk store is closed");
    }

    private void flushSafely() {
        if (closed || pending.isEmpty()) {
            return;
        }
        try {
            completeUpTo(wal.sync());
        } catch (ChunkStoreException e) {
            // The waiters are the callers that need to see this.
            log.log(Level.WARNING, "WAL flush failed; failing pending writes", e);
            failPending(e);
        }
    }

    private void completeUpTo(long synced) {
        var covered = pending.headMap(synced, true);
        for (var e : covered.entrySet()) {
            e.getValue().complete(null);
        }
        covered.clear();
    }

    private void failPending(ChunkStoreException cause) {
        for (var e : pending.entrySet()) {
            e.getValue().completeExceptionally(cause);
        }
        pending.clear();
    }

    /**
     * Recovery procedure called from the constructor: replay WAL records in
     * order, indexing the first occurrence of each address.
     */
    private void recover() {
        int records = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (Wal.Entry e; (e = r.next()) != null; ) {
                Chunk c = RecordCodec.decode(e.payload());
                index.putIfAbsent(c.address(), e.location());
                records++;
            }
        }
        int replayed = records;
        log.info(() -> "recovered " + index.size() + " chunks from " + replayed + " WAL records");
    }
}
