package io.chunklite.storage.net;

import io.chunklite.core.Chunk;
import io.chunklite.core.FetchContext;

import java.util.concurrent.TimeoutException;

/**
 * Deferred blocking fetch returned by {@link NetStore#probe}: nothing waits
 * until {@link #fetch} is called.
 */
@FunctionalInterface
public interface ChunkFetch {

    Chunk fetch(FetchContext ctx, String requester) throws InterruptedException, TimeoutException;
}
