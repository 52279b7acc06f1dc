// file: src/main/java/io/chunklite/storage/net/NetStore.java
package io.chunklite.storage.net;

import io.chunklite.core.Address;
import io.chunklite.core.Chunk;
import io.chunklite.core.FetchContext;
import io.chunklite.storage.ChunkStore;
import io.chunklite.storage.DurabilityWait;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Local chunk store extended with network retrieval.
 * <p>
 * Responsibilities:
 *  - get(): return a local chunk, or join the single fetch session for a
 *    missing address and block until the chunk is delivered or the caller's
 *    context ends.
 *  - put(): write to the local store and, if a session is waiting for that
 *    address, deliver the chunk to it.
 *  - Guarantee at most one live session per address.
 * <p>
 * Locking:
 *  - One lock covers "store lookup + session find-or-create" in get() and
 *    "store write + session deliver" in put(). With both pairs atomic a chunk
 *    can neither be delivered before its session exists nor be written just
 *    after a lookup missed it without the session seeing it.
 *  - The lock is never held while a caller waits for delivery.
 *  - Session teardown takes the lock only to remove the table entry.
 */
public class NetStore implements AutoCloseable {
    private static final Logger log = Logger.getLogger(NetStore.class.getName());

    /** Default bound on concurrently tracked fetch sessions. */
    public static final int DEFAULT_SESSION_TABLE_CAPACITY = 5000;

    private final ReentrantLock lock = new ReentrantLock();
    private final ChunkStore store;
    private final RemoteFetcherFactory fetchers;
    private final SessionTable sessions;

    public NetStore(ChunkStore store, RemoteFetcherFactory fetchers) {
        this(store, fetchers, DEFAULT_SESSION_TABLE_CAPACITY);
    }

    /**
     * @param store                durable local store
     * @param fetchers             creates the remote fetcher for each new session
     * @param sessionTableCapacity bound on fetch-session bookkeeping
     */
    public NetStore(ChunkStore store, RemoteFetcherFactory fetchers, int sessionTableCapacity) {
        this.store = Objects.requireNonNull(store, "store");
        this.fetchers = Objects.requireNonNull(fetchers, "fetchers");
        this.sessions = new SessionTable(sessionTableCapacity);
    }

    /**
     * Store a chunk locally and hand it to any session waiting for it.
     *
     * @return null if the chunk was already stored, otherwise a wait for durability
     * @throws io.chunklite.storage.ChunkStoreException if the local write fails (no session is touched)
     * @throws IllegalStateException if a session for this address was already delivered
     */
    public DurabilityWait put(Chunk chunk) {
        Objects.requireNonNull(chunk, "chunk");
        lock.lock();
        try {
            DurabilityWait wait = store.put(chunk);
            FetchSession session = sessions.get(chunk.address());
            if (wait == null) {
                // Already stored. A pending session can only exist here by race; still notify it.
                if (session != null && !session.isDelivered()) {
                    session.deliver(chunk);
                }
                return null;
            }
            if (session != null) {
                session.deliver(chunk);
                log.fine(() -> "delivered " + chunk.address() + " to " + session.activeRequesters() + " waiters");
            }
            return wait;
        } finally {
            lock.unlock();
        }
    }

    /** {@link #get(FetchContext, Address, String)} without a requester identity. */
    public Chunk get(FetchContext ctx, Address address) throws InterruptedException, TimeoutException {
        return get(ctx, address, null);
    }

    /**
     * Return the chunk, fetching it from the network if it is not local.
     *
     * @param ctx       bounds how long this caller waits
     * @param address   chunk to return
     * @param requester identity of the party asking (recorded on the session), or null
     * @throws TimeoutException if ctx's deadline passes first
     * @throws java.util.concurrent.CancellationException if ctx is cancelled first
     */
    public Chunk get(FetchContext ctx, Address address, String requester)
            throws InterruptedException, TimeoutException {
        Objects.requireNonNull(ctx, "ctx");
        Objects.requireNonNull(address, "address");
        FetchSession session;
        lock.lock();
        try {
            Chunk local = store.get(address);
            if (local != null) {
                return local;
            }
            session = joinSession(address);
        } finally {
            lock.unlock();
        }
        return session.await(requester, ctx);
    }

    /**
     * Check for a chunk without committing to wait for it.
     * <p>
     * Registers a fetch session when the chunk is missing, but does not start
     * the remote fetch or pin the session until the returned fetch is called.
     *
     * @return null if the chunk is stored locally, otherwise the blocking fetch
     */
    public ChunkFetch probe(Address address) {
        Objects.requireNonNull(address, "address");
        FetchSession session;
        lock.lock();
        try {
            if (store.get(address) != null) {
                return null;
            }
            session = findOrCreate(address);
        } finally {
            lock.unlock();
        }
        return (ctx, requester) -> {
            if (session.join()) {
                return session.await(requester, ctx);
            }
            // Evicted or torn down while the caller was deciding: start over.
            return get(ctx, address, requester);
        };
    }

    /** Local-only lookup: never creates a session. Null when absent. */
    public Chunk getLocal(Address address) {
        Objects.requireNonNull(address, "address");
        return store.get(address);
    }

    /** Number of fetch sessions currently tracked. */
    public int activeSessions() {
        lock.lock();
        try {
            return sessions.size();
        } finally {
            lock.unlock();
        }
    }

    /** Whether a fetch session is currently tracked for {@code address}. */
    public boolean hasSession(Address address) {
        lock.lock();
        try {
            return sessions.contains(address);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Close the local store. Sessions are not cancelled: waiters end through
     * their own contexts.
     */
    @Override
    public void close() {
        store.close();
    }

    // ---------- session bookkeeping (caller holds the lock) ----------

    private FetchSession joinSession(Address address) {
        FetchSession session = sessions.get(address);
        if (session != null && session.join()) {
            return session;
        }
        session = create(address);
        if (!session.join()) {
            throw new IllegalStateException("fresh fetch session for " + address + " already retired");
        }
        return session;
    }

    private FetchSession findOrCreate(Address address) {
        FetchSession session = sessions.get(address);
        if (session != null && !session.isRetired()) {
            return session;
        }
        return create(address);
    }

    private FetchSession create(Address address) {
        FetchContext lifetime = FetchContext.background();
        FetchSession session = new FetchSession(address, lifetime, fetchers, this::teardown);
        List<FetchSession> evicted = sessions.put(address, session);
        log.fine(() -> "created fetch session for " + address);
        for (FetchSession e : evicted) {
            log.fine(() -> "evicted idle fetch session for " + e.address());
        }
        return session;
    }

    /** Runs once per session, on the thread of its last leaving waiter. */
    private void teardown(FetchSession session) {
        lock.lock();
        try {
            sessions.remove(session.address(), session);
        } finally {
            lock.unlock();
        }
        log.fine(() -> "tore down fetch session for " + session.address()
                + (session.isDelivered() ? " (delivered)" : " (abandoned)"));
    }
}
