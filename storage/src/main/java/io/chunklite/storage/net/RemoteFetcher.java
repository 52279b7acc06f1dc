package io.chunklite.storage.net;

import io.chunklite.core.FetchContext;

/**
 * Per-address handle on whatever network activity retrieves a missing chunk.
 * <p>
 * {@link #request} is a fire-and-forget nudge, invoked once for every waiter
 * that joins the session. It must not block: the chunk arrives later through
 * {@link NetStore#put}, never as a return value.
 */
@FunctionalInterface
public interface RemoteFetcher {

    /**
     * @param requester identity of the party asking (for example a peer node id), or null
     * @param ctx       the requesting waiter's own context
     */
    void request(String requester, FetchContext ctx);
}
