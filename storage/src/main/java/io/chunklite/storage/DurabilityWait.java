// file: src/main/java/io/chunklite/storage/DurabilityWait.java
package io.chunklite.storage;

import io.chunklite.core.FetchContext;

import java.util.concurrent.TimeoutException;

/**
 * Blocks until a freshly written chunk is durable (fsynced), or until the
 * caller's context ends.
 */
@FunctionalInterface
public interface DurabilityWait {

    void await(FetchContext ctx) throws InterruptedException, TimeoutException;
}
