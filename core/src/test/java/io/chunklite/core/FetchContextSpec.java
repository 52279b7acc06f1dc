package io.chunklite.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deadline, cancellation and await semantics of FetchContext.
 */
class FetchContextSpec {

    @Test
    void await_returns_value_once_future_completes() throws Exception {
        var ctx = FetchContext.timeout(Duration.ofSeconds(5));
        var f = new CompletableFuture<String>();

        new Thread(() -> f.complete("done")).start();

        assertEquals("done", ctx.await(f));
    }

    @Test
    void await_times_out_at_the_deadline() {
        var ctx = FetchContext.timeout(Duration.ofMillis(50));
        long start = System.nanoTime();

        assertThrows(TimeoutException.class, () -> ctx.await(new CompletableFuture<>()));
        assertTrue(System.nanoTime() - start >= Duration.ofMillis(40).toNanos());
        assertTrue(ctx.isExpired());
        assertEquals(Duration.ZERO, ctx.remaining());
    }

    @Test
    void already_expired_deadline_still_returns_a_completed_value() throws Exception {
        var ctx = FetchContext.timeout(Duration.ZERO);

        assertEquals(7, ctx.await(CompletableFuture.completedFuture(7)));
    }

    @Test
    void cancel_wakes_a_blocked_waiter() throws Exception {
        var ctx = FetchContext.background();
        var caught = new CompletableFuture<Throwable>();

        Thread t = new Thread(() -> {
            try {
                ctx.await(new CompletableFuture<>());
                caught.complete(null);
            } catch (Throwable e) {
                caught.complete(e);
            }
        });
        t.start();
        Thread.sleep(50);
        ctx.cancel();
        t.join(2000);

        assertInstanceOf(CancellationException.class, caught.get());
    }

    @Test
    void parent_cancel_reaches_children_but_not_the_other_way_round() {
        var parent = FetchContext.background();
        var a = parent.child();
        var b = parent.withTimeout(Duration.ofSeconds(30));

        a.cancel();
        assertTrue(a.isCancelled());
        assertFalse(parent.isCancelled());
        assertFalse(b.isCancelled());

        parent.cancel();
        assertTrue(b.isCancelled());
        assertTrue(b.isDone());
    }

    @Test
    void child_deadline_never_exceeds_parent_deadline() {
        var parent = FetchContext.timeout(Duration.ofMillis(100));
        var child = parent.withTimeout(Duration.ofHours(1));

        assertNotNull(child.remaining());
        assertTrue(child.remaining().compareTo(Duration.ofMillis(100)) <= 0);
        assertNull(FetchContext.background().remaining());
    }

    @Test
    void on_cancel_runs_callbacks() {
        var ctx = FetchContext.background();
        var ran = new AtomicBoolean();
        ctx.onCancel(() -> ran.set(true));

        assertFalse(ran.get());
        ctx.cancel();
        assertTrue(ran.get());
    }

    @Test
    void exceptional_completion_surfaces_the_runtime_cause() {
        var ctx = FetchContext.timeout(Duration.ofSeconds(1));
        var f = new CompletableFuture<String>();
        f.completeExceptionally(new IllegalStateException("boom"));

        var e = assertThrows(IllegalStateException.class, () -> ctx.await(f));
        assertEquals("boom", e.getMessage());
    }

    @Test
    void repeated_awaits_on_one_context_leave_no_listeners_behind() throws Exception {
        var ctx = FetchContext.background();
        for (int i = 0; i < 1000; i++) {
            ctx.await(CompletableFuture.completedFuture(new byte[1024]));
        }
        var timed = FetchContext.timeout(Duration.ofSeconds(5));
        for (int i = 0; i < 100; i++) {
            var f = new CompletableFuture<String>();
            f.completeExceptionally(new IllegalStateException("fail " + i));
            assertThrows(IllegalStateException.class, () -> timed.await(f));
        }

        assertEquals(0, ctx.listenerCount());
        assertEquals(0, timed.listenerCount());
    }

    @Test
    void timed_out_await_unregisters_its_listener() {
        var ctx = FetchContext.timeout(Duration.ofMillis(10));

        assertThrows(TimeoutException.class, () -> ctx.await(new CompletableFuture<>()));
        assertEquals(0, ctx.listenerCount());
    }

    @Test
    void cancelled_children_are_dropped_by_their_parent() {
        var parent = FetchContext.background();
        for (int i = 0; i < 100; i++) {
            parent.withTimeout(Duration.ofSeconds(1)).cancel();
        }
        var live = parent.child();

        assertEquals(1, parent.listenerCount());
        parent.cancel();
        assertTrue(live.isCancelled());
        assertEquals(0, parent.listenerCount());
    }

    @Test
    void listener_added_after_cancel_runs_immediately() {
        var ctx = FetchContext.background();
        ctx.cancel();
        var ran = new AtomicBoolean();

        ctx.onCancel(() -> ran.set(true));

        assertTrue(ran.get());
        assertTrue(ctx.child().isCancelled());
    }
}
