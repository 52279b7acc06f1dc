// file: src/main/java/io/chunklite/core/FetchContext.java
package io.chunklite.core;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellable, optionally deadline-bound lifetime of one request (or of one
 * background activity such as a remote fetch).
 * <p>
 * Semantics:
 *  - A context is "done" once it is cancelled or its deadline has passed.
 *  - Children derived with {@link #child()} / {@link #withTimeout(Duration)}
 *    are cancelled when their parent is cancelled; cancelling a child never
 *    affects the parent or its siblings.
 *  - A child's deadline is the earlier of its own and its parent's.
 * <p>
 * {@link #await(CompletableFuture)} is the single blocking primitive: it returns
 * the future's value, or fails with the context's termination error:
 *  - deadline passed -> {@link TimeoutException}
 *  - cancelled       -> {@link CancellationException}
 *  - thread interrupted -> {@link InterruptedException}
 * <p>
 * Cancellation listeners are held in a removable set: a wait unregisters its
 * listener when it returns, and a cancelled child unregisters from its parent.
 * A child that is no longer needed should be cancelled so its parent drops it.
 */
public final class FetchContext {
    private static final long NO_DEADLINE = Long.MAX_VALUE;

    /** Deadline on the System.nanoTime() scale, or NO_DEADLINE. */
    private final long deadlineNanos;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Set<Runnable> listeners = ConcurrentHashMap.newKeySet();
    private final FetchContext parent;
    private final Runnable cancelFromParent = this::cancel;

    private FetchContext(long deadlineNanos, FetchContext parent) {
        this.deadlineNanos = deadlineNanos;
        this.parent = parent;
    }

    /** Root context: no deadline, only ends when cancelled. */
    public static FetchContext background() {
        return new FetchContext(NO_DEADLINE, null);
    }

    /** Root context that expires after {@code timeout}. */
    public static FetchContext timeout(Duration timeout) {
        return background().withTimeout(timeout);
    }

    /** Cancellable child with the same deadline. */
    FetchContext child() {
        return derive(deadlineNanos);
    }

    /** Child whose deadline is min(parent deadline, now + timeout). */
    public FetchContext withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        long candidate = System.nanoTime() + saturatedNanos(timeout);
        long deadline = hasDeadline() && deadlineNanos - candidate < 0 ? deadlineNanos : candidate;
        return derive(deadline);
    }

    private FetchContext derive(long deadline) {
        FetchContext c = new FetchContext(deadline, this);
        register(c.cancelFromParent);
        return c;
    }

    /** Cancel this context and all of its children. Idempotent. */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        if (parent != null) {
            parent.unregister(cancelFromParent);
        }
        for (Runnable r : listeners) {
            if (listeners.remove(r)) {
                r.run();
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean hasDeadline() {
        return deadlineNanos != NO_DEADLINE;
    }

    public boolean isExpired() {
        return hasDeadline() && deadlineNanos - System.nanoTime() <= 0;
    }

    public boolean isDone() {
        return isCancelled() || isExpired();
    }

    /**
     * Time left before the deadline, {@link Duration#ZERO} once passed,
     * or null when the context has no deadline.
     */
    public Duration remaining() {
        if (!hasDeadline()) {
            return null;
        }
        long left = deadlineNanos - System.nanoTime();
        return left <= 0 ? Duration.ZERO : Duration.ofNanos(left);
    }

    /** Run {@code action} once when this context is cancelled (immediately if it already is). */
    public void onCancel(Runnable action) {
        Objects.requireNonNull(action, "action");
        register(action);
    }

    /**
     * Block until {@code future} completes or this context ends, whichever is first.
     * A future that completed exceptionally rethrows its (unchecked) cause.
     */
    public <T> T await(CompletableFuture<T> future) throws InterruptedException, TimeoutException {
        Objects.requireNonNull(future, "future");
        CompletableFuture<T> race = new CompletableFuture<>();
        future.whenComplete((v, t) -> {
            if (t != null) {
                race.completeExceptionally(t);
            } else {
                race.complete(v);
            }
        });
        Runnable onCancel = () -> race.completeExceptionally(
                new CancellationException("fetch context cancelled"));
        register(onCancel);

        try {
            if (!hasDeadline()) {
                return race.get();
            }
            long left = deadlineNanos - System.nanoTime();
            if (left <= 0 && !race.isDone()) {
                throw deadlineExceeded();
            }
            return race.get(Math.max(left, 0L), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw deadlineExceeded();
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } finally {
            unregister(onCancel);
        }
    }

    /** Registered cancellation listeners; waits and live children each hold one. */
    int listenerCount() {
        return listeners.size();
    }

    /** Add a listener, running it right away if this context is already cancelled. */
    private void register(Runnable listener) {
        listeners.add(listener);
        // cancel() may have swept the set before the add; whoever removes the entry runs it
        if (cancelled.get() && listeners.remove(listener)) {
            listener.run();
        }
    }

    private void unregister(Runnable listener) {
        listeners.remove(listener);
    }

    private static TimeoutException deadlineExceeded() {
        return new TimeoutException("fetch context deadline exceeded");
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException re) {
            return re;
        }
        if (cause instanceof Error err) {
            throw err;
        }
        return new CompletionException(cause);
    }

    private static long saturatedNanos(Duration d) {
        try {
            return d.toNanos();
        } catch (ArithmeticException overflow) {
            return d.isNegative() ? Long.MIN_VALUE / 2 : Long.MAX_VALUE / 2;
        }
    }
}
