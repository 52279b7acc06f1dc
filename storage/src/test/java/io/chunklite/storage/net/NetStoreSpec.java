// file: src/test/java/io/chunklite/storage/net/NetStoreSpec.java
package io.chunklite.storage.net;

import io.chunklite.core.Address;
import io.chunklite.core.Chunk;
import io.chunklite.core.FetchContext;
import io.chunklite.storage.ChunkStoreException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Retrieval coordination: session dedup, delivery, cancellation and teardown.
 */
class NetStoreSpec {

    private MemoryChunkStore store;
    private RecordingFetchers fetchers;
    private NetStore net;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        store = new MemoryChunkStore();
        fetchers = new RecordingFetchers();
        net = new NetStore(store, fetchers);
        pool = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private static Chunk chunk(String s) {
        return Chunk.of(s.getBytes(StandardCharsets.UTF_8));
    }

    private static FetchContext seconds(int n) {
        return FetchContext.timeout(Duration.ofSeconds(n));
    }

    private Future<Chunk> readAsync(FetchContext ctx, Address address, String requester) {
        return pool.submit(() -> net.get(ctx, address, requester));
    }

    @Test
    void concurrent_reads_share_one_session_and_all_receive_the_written_chunk() throws Exception {
        Chunk a = chunk("shared payload");
        int n = 8;

        List<Future<Chunk>> reads = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            reads.add(readAsync(seconds(5), a.address(), null));
        }
        fetchers.awaitRequests(n);

        assertNotNull(net.put(a));

        for (Future<Chunk> r : reads) {
            assertEquals(a, r.get(5, TimeUnit.SECONDS));
        }
        assertEquals(1, fetchers.created.get(), "exactly one session for the address");
    }

    @Test
    void read_of_a_local_chunk_returns_immediately_without_a_session() throws Exception {
        Chunk y = chunk("world");
        store.put(y);

        assertEquals(y, net.get(seconds(1), y.address()));
        assertEquals(0, fetchers.created.get());
        assertEquals(0, net.activeSessions());
    }

    @Test
    void blocked_read_is_released_by_a_later_write() throws Exception {
        Chunk x = chunk("hello");

        Future<Chunk> reader = readAsync(seconds(5), x.address(), null);
        fetchers.awaitRequests(1);
        assertTrue(net.hasSession(x.address()));

        net.put(x);

        Chunk got = reader.get(5, TimeUnit.SECONDS);
        assertEquals(x.address(), got.address());
        assertArrayEquals("hello".getBytes(StandardCharsets.UTF_8), got.data());
    }

    @Test
    void cancelling_one_waiter_leaves_the_others_waiting() throws Exception {
        Chunk a = chunk("cancel me");
        FetchContext quitter = FetchContext.background();

        Future<Chunk> cancelled = readAsync(quitter, a.address(), null);
        Future<Chunk> patient1 = readAsync(seconds(5), a.address(), null);
        Future<Chunk> patient2 = readAsync(seconds(5), a.address(), null);
        fetchers.awaitRequests(3);

        quitter.cancel();
        ExecutionException e = assertThrows(ExecutionException.class, () -> cancelled.get(5, TimeUnit.SECONDS));
        assertInstanceOf(CancellationException.class, e.getCause());
        assertTrue(net.hasSession(a.address()), "session survives while others wait");
        assertFalse(fetchers.lifetimes.get(0).isCancelled());

        net.put(a);

        assertEquals(a, patient1.get(5, TimeUnit.SECONDS));
        assertEquals(a, patient2.get(5, TimeUnit.SECONDS));
        assertEquals(1, fetchers.created.get());
    }

    @Test
    void immediate_deadline_fails_and_tears_the_session_down() {
        Address z = chunk("addrZ").address();

        assertThrows(TimeoutException.class, () -> net.get(FetchContext.timeout(Duration.ZERO), z));

        assertFalse(net.hasSession(z));
        assertEquals(0, net.activeSessions());
        assertTrue(fetchers.lifetimes.get(0).isCancelled(), "abandoned session cancels its fetch lifetime");
    }

    @Test
    void after_teardown_a_new_miss_creates_a_fresh_session() throws Exception {
        Chunk a = chunk("again");

        Future<Chunk> first = readAsync(seconds(5), a.address(), null);
        fetchers.awaitRequests(1);
        net.put(a);
        first.get(5, TimeUnit.SECONDS);
        // the last waiter tears down after returning
        waitUntil(() -> !net.hasSession(a.address()));
        assertTrue(fetchers.lifetimes.get(0).isCancelled());

        Address other = chunk("never arrives").address();
        assertThrows(TimeoutException.class, () -> net.get(FetchContext.timeout(Duration.ofMillis(20)), other));
        fetchers.awaitRequests(1);
        assertFalse(net.hasSession(other));

        Future<Chunk> second = readAsync(FetchContext.timeout(Duration.ofMillis(200)), other, null);
        fetchers.awaitRequests(1);
        assertTrue(net.hasSession(other));
        assertEquals(3, fetchers.created.get(), "one session per lifetime of interest");
        assertThrows(ExecutionException.class, () -> second.get(5, TimeUnit.SECONDS));
    }

    @Test
    void every_waiter_receives_the_identical_chunk() throws Exception {
        Chunk a = chunk("same for all");
        List<Future<Chunk>> reads = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            reads.add(readAsync(seconds(5), a.address(), "peer-" + i));
        }
        fetchers.awaitRequests(10);
        net.put(a);

        Chunk first = reads.get(0).get(5, TimeUnit.SECONDS);
        for (Future<Chunk> r : reads) {
            assertSame(first, r.get(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void requesters_are_visible_to_the_fetcher_while_waiting() throws Exception {
        Chunk a = chunk("who asks");

        Future<Chunk> r1 = readAsync(seconds(5), a.address(), "peer-1");
        Future<Chunk> r2 = readAsync(seconds(5), a.address(), "peer-2");
        fetchers.awaitRequests(2);

        var view = fetchers.requesterViews.get(a.address());
        assertEquals(java.util.Set.of("peer-1", "peer-2"), view);
        assertTrue(fetchers.requesterLog.containsAll(List.of("peer-1", "peer-2")));

        net.put(a);
        r1.get(5, TimeUnit.SECONDS);
        r2.get(5, TimeUnit.SECONDS);
        waitUntil(view::isEmpty);
    }

    @Test
    void put_of_an_existing_chunk_returns_null() {
        Chunk a = chunk("dup");

        assertNotNull(net.put(a));
        assertNull(net.put(a));
        assertEquals(1, store.newWrites.get());
    }

    @Test
    void store_write_failure_propagates_and_leaves_the_session_pending() throws Exception {
        Chunk a = chunk("fails first");
        Future<Chunk> reader = readAsync(seconds(5), a.address(), null);
        fetchers.awaitRequests(1);

        store.failPuts = new ChunkStoreException("disk full");
        var e = assertThrows(ChunkStoreException.class, () -> net.put(a));
        assertEquals("disk full", e.getMessage());
        assertFalse(reader.isDone());

        store.failPuts = null;
        net.put(a);
        assertEquals(a, reader.get(5, TimeUnit.SECONDS));
    }

    @Test
    void store_lookup_failure_propagates_without_creating_a_session() {
        store.failGets = new ChunkStoreException("io error");

        assertThrows(ChunkStoreException.class, () -> net.get(seconds(1), chunk("x").address()));
        assertEquals(0, fetchers.created.get());
    }

    @Test
    void probe_returns_null_for_local_chunks_and_a_deferred_fetch_otherwise() throws Exception {
        Chunk local = chunk("here");
        Chunk remote = chunk("there");
        store.put(local);

        assertNull(net.probe(local.address()));

        ChunkFetch fetch = net.probe(remote.address());
        assertNotNull(fetch);
        assertTrue(net.hasSession(remote.address()));
        assertTrue(fetchers.requesterLog.isEmpty(), "probe alone must not start fetching");

        Future<Chunk> waiting = pool.submit(() -> fetch.fetch(seconds(5), "peer-x"));
        fetchers.awaitRequests(1);
        net.put(remote);

        assertEquals(remote, waiting.get(5, TimeUnit.SECONDS));
        assertEquals(1, fetchers.created.get());
    }

    @Test
    void probe_fetch_after_eviction_starts_over() throws Exception {
        net = new NetStore(store, fetchers, 1);
        Chunk a = chunk("evicted");
        ChunkFetch stale = net.probe(a.address());
        // an idle probed session is evictable
        net.probe(chunk("pushes it out").address());
        assertFalse(net.hasSession(a.address()));
        assertTrue(fetchers.lifetimes.get(0).isCancelled());

        Future<Chunk> waiting = pool.submit(() -> stale.fetch(seconds(5), null));
        fetchers.awaitRequests(1);
        net.put(a);

        assertEquals(a, waiting.get(5, TimeUnit.SECONDS));
        assertEquals(3, fetchers.created.get());
    }

    @Test
    void sessions_with_waiters_are_never_evicted() throws Exception {
        net = new NetStore(store, fetchers, 1);
        Chunk a = chunk("pinned a");
        Chunk b = chunk("pinned b");

        Future<Chunk> ra = readAsync(seconds(5), a.address(), null);
        fetchers.awaitRequests(1);
        Future<Chunk> rb = readAsync(seconds(5), b.address(), null);
        fetchers.awaitRequests(1);

        assertEquals(2, net.activeSessions(), "over capacity rather than dropping a live session");

        Future<Chunk> ra2 = readAsync(seconds(5), a.address(), null);
        fetchers.awaitRequests(1);
        assertEquals(2, fetchers.created.get(), "no duplicate session for a pinned address");

        net.put(a);
        net.put(b);
        assertEquals(a, ra.get(5, TimeUnit.SECONDS));
        assertEquals(a, ra2.get(5, TimeUnit.SECONDS));
        assertEquals(b, rb.get(5, TimeUnit.SECONDS));
    }

    @Test
    void racing_reads_and_write_never_lose_the_delivery() throws Exception {
        for (int round = 0; round < 50; round++) {
            Chunk c = chunk("race-" + round);
            CountDownLatch go = new CountDownLatch(1);
            List<Future<Chunk>> reads = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                reads.add(pool.submit(() -> {
                    go.await();
                    return net.get(seconds(5), c.address());
                }));
            }
            Future<?> writer = pool.submit(() -> {
                go.await();
                return net.put(c);
            });
            go.countDown();

            writer.get(5, TimeUnit.SECONDS);
            for (Future<Chunk> r : reads) {
                assertEquals(c, r.get(5, TimeUnit.SECONDS));
            }
        }
    }

    @Test
    void close_closes_the_local_store() {
        net.close();
        assertTrue(store.closed);
    }

    private static void waitUntil(java.util.function.BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not reached within 5s");
            }
            Thread.sleep(5);
        }
    }
}
