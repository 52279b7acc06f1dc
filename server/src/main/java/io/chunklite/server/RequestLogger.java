// file: server/src/main/java/io/chunklite/server/RequestLogger.java
package io.chunklite.server;

import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One access-log line per chunk request.
 * <p>
 * Created when a handler starts, it times the whole request and, separately,
 * the part spent blocked in NetStore (local lookup, fetch wait or durability
 * wait). The requesting peer, when the call came from another node, is part
 * of the line so fan-out between nodes can be followed across logs.
 * <p>
 * Levels:
 * <pre>
 *   5xx (except 504)          WARNING, with the stack trace
 *   504 / 503                 INFO, the caller's deadline or cancellation
 *   404 on ?local=true        FINE, peers miss routinely while fanning out
 *   other 4xx                 INFO, with the error message
 *   admin routes              FINE
 *   everything else           INFO
 * </pre>
 */
final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private final String method;
    private final String path;
    private final long startNanos;
    private String requester;
    private boolean localOnly;
    private long storeStartNanos = -1L;
    private long storeNanos = -1L;

    private RequestLogger(String method, String path) {
        this.method = method;
        this.path = path;
        this.startNanos = System.nanoTime();
    }

    static RequestLogger start(String method, String path) {
        return new RequestLogger(method, path);
    }

    RequestLogger requester(String requester) {
        this.requester = requester;
        return this;
    }

    RequestLogger localOnly(boolean localOnly) {
        this.localOnly = localOnly;
        return this;
    }

    void storeStarted() {
        storeStartNanos = System.nanoTime();
    }

    void storeFinished() {
        if (storeStartNanos >= 0) {
            storeNanos = System.nanoTime() - storeStartNanos;
        }
    }

    /** Emits the line. {@code error} may be null. */
    void finish(int status, Throwable error) {
        long totalMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        long storeMs = storeNanos >= 0 ? TimeUnit.NANOSECONDS.toMillis(storeNanos) : -1L;
        String msg = format(method, path, status, totalMs, storeMs, requester);

        Level level = levelFor(status);
        if (!log.isLoggable(level)) {
            return;
        }
        if (error != null && status >= 500 && status != 504) {
            log.log(level, msg, error);
        } else if (error != null && status >= 400) {
            log.log(level, msg + ": " + error.getMessage());
        } else {
            log.log(level, msg);
        }
    }

    Level levelFor(int status) {
        if (status >= 500 && status != 504) {
            return Level.WARNING;
        }
        if (status == 404 && localOnly) {
            return Level.FINE;
        }
        if (status < 400 && path.startsWith("/admin/")) {
            return Level.FINE;
        }
        return Level.INFO;
    }

    static String format(String method, String path, int status, long totalMs, long storeMs, String requester) {
        StringBuilder sb = new StringBuilder()
                .append(method).append(' ').append(path)
                .append(" -> ").append(status)
                .append(" (total=").append(totalMs).append("ms");
        if (storeMs >= 0) {
            sb.append(", wait=").append(storeMs).append("ms");
        }
        if (requester != null) {
            sb.append(", requester=").append(requester);
        }
        return sb.append(')').toString();
    }
}
