// file: src/main/java/io/chunklite/storage/net/FetchSession.java
package io.chunklite.storage.net;

import io.chunklite.core.Address;
import io.chunklite.core.Chunk;
import io.chunklite.core.FetchContext;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * One outstanding remote retrieval for one address, shared by every waiter
 * interested in that address.
 * <p>
 * State machine (driven by a single atomic counter):
 * <pre>
 *   created (0) --join--> awaiting (n >= 1) --last leave--> RETIRED
 *   created (0) --evicted while idle-------------------->  RETIRED
 * </pre>
 * Delivery is orthogonal: it can happen at any point before retirement and
 * wakes every current and future waiter. A retired session accepts no joins;
 * NetStore then creates a fresh session for the address.
 * <p>
 * Protocol:
 *  - {@link #join()} pins the session (NetStore calls it under its lock).
 *  - {@link #await} must follow exactly one successful join; it releases the
 *    pin on every exit path.
 *  - The transition 1 -> RETIRED is a single CAS, so exactly one waiter runs
 *    the teardown (cancel the lifetime, remove from the table).
 */
final class FetchSession {
    static final int RETIRED = -1;

    private final Address address;
    private final CompletableFuture<Chunk> delivered = new CompletableFuture<>();
    private final AtomicInteger active = new AtomicInteger();
    /** requester -> number of its waiters; keys exposed to the fetcher. */
    private final Map<String, Integer> requesters = new ConcurrentHashMap<>();
    private final FetchContext lifetime;
    private final RemoteFetcher fetcher;
    private final Consumer<FetchSession> onTeardown;

    FetchSession(Address address,
                 FetchContext lifetime,
                 RemoteFetcherFactory fetchers,
                 Consumer<FetchSession> onTeardown) {
        this.address = Objects.requireNonNull(address, "address");
        this.lifetime = Objects.requireNonNull(lifetime, "lifetime");
        this.onTeardown = Objects.requireNonNull(onTeardown, "onTeardown");
        this.fetcher = Objects.requireNonNull(
                fetchers.create(lifetime, address, Collections.unmodifiableSet(requesters.keySet())),
                "fetcher");
    }

    Address address() {
        return address;
    }

    /**
     * Register one more active requester.
     *
     * @return false if the session already retired and must not be used
     */
    boolean join() {
        while (true) {
            int n = active.get();
            if (n == RETIRED) {
                return false;
            }
            if (active.compareAndSet(n, n + 1)) {
                return true;
            }
        }
    }

    /**
     * Wait for the chunk on behalf of one joined requester.
     * <p>
     * Nudges the remote fetcher, then blocks until delivery or until
     * {@code ctx} ends. Always leaves the session before returning.
     */
    Chunk await(String requester, FetchContext ctx) throws InterruptedException, TimeoutException {
        Objects.requireNonNull(ctx, "ctx");
        if (requester != null) {
            requesters.merge(requester, 1, Integer::sum);
        }
        try {
            fetcher.request(requester, ctx);
            return ctx.await(delivered);
        } finally {
            if (requester != null) {
                requesters.computeIfPresent(requester, (k, n) -> n == 1 ? null : n - 1);
            }
            leave();
        }
    }

    /**
     * Supply the chunk, waking every waiter. A session is delivered at most
     * once; a second delivery means two writers both believed the chunk was
     * new, which is a bug upstream.
     */
    void deliver(Chunk chunk) {
        Objects.requireNonNull(chunk, "chunk");
        if (!address.equals(chunk.address())) {
            throw new IllegalArgumentException(
                    "chunk " + chunk.address() + " delivered to session for " + address);
        }
        if (!delivered.complete(chunk)) {
            throw new IllegalStateException("chunk " + address + " delivered twice to the same session");
        }
    }

    boolean isDelivered() {
        return delivered.isDone();
    }

    boolean isRetired() {
        return active.get() == RETIRED;
    }

    /** Active requester count (0 once retired). */
    int activeRequesters() {
        return Math.max(active.get(), 0);
    }

    Set<String> requesters() {
        return Collections.unmodifiableSet(requesters.keySet());
    }

    /**
     * Retire the session if nobody is waiting on it. Used by eviction; the
     * caller removes it from the table.
     */
    boolean retireIfIdle() {
        if (active.compareAndSet(0, RETIRED)) {
            lifetime.cancel();
            return true;
        }
        return false;
    }

    private void leave() {
        while (true) {
            int n = active.get();
            if (n <= 0) {
                throw new IllegalStateException("leave without join on session " + address);
            }
            if (n == 1) {
                if (active.compareAndSet(1, RETIRED)) {
                    lifetime.cancel();
                    onTeardown.accept(this);
                    return;
                }
            } else if (active.compareAndSet(n, n - 1)) {
                return;
            }
        }
    }

    @Override
    public String toString() {
        return "FetchSession{" + address + ", active=" + active.get() + ", delivered=" + isDelivered() + "}";
    }
}
