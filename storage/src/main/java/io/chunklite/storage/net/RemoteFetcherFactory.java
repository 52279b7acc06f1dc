package io.chunklite.storage.net;

import io.chunklite.core.Address;
import io.chunklite.core.FetchContext;

import java.util.Set;

/**
 * Creates the {@link RemoteFetcher} for a new fetch session.
 * <p>
 * Called by NetStore while it holds its lock, so implementations must only
 * set up state here and start network work from {@link RemoteFetcher#request}.
 */
@FunctionalInterface
public interface RemoteFetcherFactory {

    /**
     * @param lifetime   cancelled when the session is torn down or evicted; stop all work then
     * @param address    the chunk being sought
     * @param requesters live, read-only view of the parties currently waiting
     */
    RemoteFetcher create(FetchContext lifetime, Address address, Set<String> requesters);

    /** Factory for nodes without peers: requests are ignored and only local puts deliver. */
    static RemoteFetcherFactory none() {
        return (lifetime, address, requesters) -> (requester, ctx) -> { };
    }
}
