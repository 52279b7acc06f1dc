// file: src/main/java/io/chunklite/storage/net/SessionTable.java
package io.chunklite.storage.net;

import io.chunklite.core.Address;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Bounded address -> FetchSession map in least-recently-used order.
 * <p>
 * Not thread-safe: every call happens under NetStore's lock, and nothing
 * outside this package can reach it.
 * <p>
 * Eviction policy when over capacity:
 *  - already retired sessions (teardown pending) go first,
 *  - then idle sessions (no active requesters), least recently used first;
 *    they are retired, which cancels their retrieval lifetime,
 *  - sessions with active requesters are pinned and never evicted. If all
 *    entries are pinned the table stays over capacity until waiters leave.
 */
final class SessionTable {
    private static final Logger log = Logger.getLogger(SessionTable.class.getName());

    private final int capacity;
    private final LinkedHashMap<Address, FetchSession> sessions = new LinkedHashMap<>(16, 0.75f, true);

    SessionTable(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0, got " + capacity);
        this.capacity = capacity;
    }

    /** Lookup that also marks the entry as recently used. */
    FetchSession get(Address address) {
        return sessions.get(address);
    }

    /**
     * Insert (or replace) the session for {@code address}, then evict down to capacity.
     *
     * @return sessions evicted to make room
     */
    List<FetchSession> put(Address address, FetchSession session) {
        sessions.put(address, session);
        if (sessions.size() <= capacity) {
            return List.of();
        }
        List<FetchSession> evicted = new ArrayList<>();
        evict(session, true, evicted);
        evict(session, false, evicted);
        if (sessions.size() > capacity) {
            log.warning("fetch session table over capacity: " + sessions.size() + "/" + capacity
                    + " sessions, all with active requesters");
        }
        return evicted;
    }

    /** One LRU-ordered pass: retired sessions only, or any idle session. */
    private void evict(FetchSession keep, boolean retiredOnly, List<FetchSession> evicted) {
        for (Iterator<Map.Entry<Address, FetchSession>> it = sessions.entrySet().iterator();
             it.hasNext() && sessions.size() > capacity; ) {
            FetchSession candidate = it.next().getValue();
            if (candidate == keep) {
                continue;
            }
            if (candidate.isRetired() || (!retiredOnly && candidate.retireIfIdle())) {
                it.remove();
                evicted.add(candidate);
            }
        }
    }

    /** Remove only if {@code address} still maps to this exact session. */
    boolean remove(Address address, FetchSession session) {
        return sessions.remove(address, session);
    }

    boolean contains(Address address) {
        return sessions.containsKey(address);
    }

    int size() {
        return sessions.size();
    }

    int capacity() {
        return capacity;
    }
}
