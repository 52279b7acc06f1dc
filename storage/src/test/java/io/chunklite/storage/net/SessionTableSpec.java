// file: src/test/java/io/chunklite/storage/net/SessionTableSpec.java
package io.chunklite.storage.net;

import io.chunklite.core.Address;
import io.chunklite.core.FetchContext;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionTableSpec {

    private final RecordingFetchers fetchers = new RecordingFetchers();

    private static Address addr(String s) {
        return Address.hashOf(s.getBytes(StandardCharsets.UTF_8));
    }

    private FetchSession session(Address a) {
        return new FetchSession(a, FetchContext.background(), fetchers, s -> { });
    }

    @Test
    void rejects_non_positive_capacity() {
        assertThrows(IllegalArgumentException.class, () -> new SessionTable(0));
        assertThrows(IllegalArgumentException.class, () -> new SessionTable(-3));
    }

    @Test
    void evicts_least_recently_used_idle_session_and_cancels_its_lifetime() {
        var table = new SessionTable(2);
        Address a = addr("a"), b = addr("b"), c = addr("c");
        FetchSession sa = session(a);
        FetchSession sb = session(b);
        table.put(a, sa);
        table.put(b, sb);

        List<FetchSession> evicted = table.put(c, session(c));

        assertEquals(List.of(sa), evicted);
        assertTrue(sa.isRetired());
        assertTrue(fetchers.lifetimes.get(0).isCancelled());
        assertFalse(table.contains(a));
        assertTrue(table.contains(b));
        assertEquals(2, table.size());
    }

    @Test
    void get_refreshes_recency() {
        var table = new SessionTable(2);
        Address a = addr("a"), b = addr("b"), c = addr("c");
        table.put(a, session(a));
        FetchSession sb = session(b);
        table.put(b, sb);

        assertNotNull(table.get(a));
        List<FetchSession> evicted = table.put(c, session(c));

        assertEquals(List.of(sb), evicted);
        assertTrue(table.contains(a));
    }

    @Test
    void pinned_sessions_stay_even_over_capacity() {
        var table = new SessionTable(1);
        Address a = addr("a"), b = addr("b");
        FetchSession sa = session(a);
        assertTrue(sa.join());
        table.put(a, sa);

        List<FetchSession> evicted = table.put(b, session(b));

        assertTrue(evicted.isEmpty());
        assertFalse(sa.isRetired());
        assertEquals(2, table.size());
    }

    @Test
    void retired_sessions_are_evicted_before_idle_ones() {
        var table = new SessionTable(2);
        Address a = addr("a"), b = addr("b"), c = addr("c");
        FetchSession sa = session(a);
        FetchSession sb = session(b);
        table.put(a, sa);
        table.put(b, sb);
        assertTrue(sb.retireIfIdle());

        List<FetchSession> evicted = table.put(c, session(c));

        assertEquals(List.of(sb), evicted);
        assertTrue(table.contains(a));
        assertFalse(sa.isRetired());
    }

    @Test
    void remove_only_drops_the_exact_session() {
        var table = new SessionTable(4);
        Address a = addr("a");
        FetchSession old = session(a);
        FetchSession fresh = session(a);
        table.put(a, old);
        table.put(a, fresh);

        assertFalse(table.remove(a, old));
        assertSame(fresh, table.get(a));
        assertTrue(table.remove(a, fresh));
        assertFalse(table.contains(a));
    }
}
