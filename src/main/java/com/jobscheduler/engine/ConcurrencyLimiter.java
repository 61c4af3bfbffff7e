package com.jobscheduler.engine;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caps how many job bodies execute at once.
 *
 * <p>{@link #acquire()} never blocks: it returns a future that completes with a
 * {@link Permit} once a slot is free. Waiters are served in arrival order.
 * A limiter built without a maximum grants every request at once but still
 * counts active permits.</p>
 *
 * <p><b>Guaranteed release:</b> a permit gives its slot back exactly once, no
 * matter how many times {@link Permit#release()} is called. Cancelling a waiting
 * acquire future withdraws it from the queue. If a slot is handed to a future
 * that was cancelled in the meantime, it moves on to the next waiter.</p>
 *
 * <p><b>Thread Safety:</b> all state is guarded by an internal lock. Waiter
 * futures are completed outside the lock so their continuations cannot
 * deadlock against callers' own locks.</p>
 *
 * @author Job Scheduler Team
 * @see Worker
 */
public class ConcurrencyLimiter {

    private final Integer maxConcurrency;  // null = unbounded
    private final Object lock = new Object();
    private final Deque<CompletableFuture<Permit>> waiters = new ArrayDeque<>();
    private int active;

    /**
     * Create a limiter.
     *
     * @param maxConcurrency maximum simultaneous permits; null, zero or negative for unbounded
     */
    public ConcurrencyLimiter(Integer maxConcurrency) {
        this.maxConcurrency = (maxConcurrency != null && maxConcurrency > 0) ? maxConcurrency : null;
    }

    /**
     * @return a limiter with no ceiling
     */
    public static ConcurrencyLimiter unbounded() {
        return new ConcurrencyLimiter(null);
    }

    /**
     * Request a slot.
     *
     * @return future completing with a permit once a slot is available
     */
    public CompletableFuture<Permit> acquire() {
        CompletableFuture<Permit> waiter;
        synchronized (lock) {
            if (maxConcurrency == null || active < maxConcurrency) {
                active++;
                return CompletableFuture.completedFuture(new Permit());
            }
            waiter = new CompletableFuture<>();
            waiters.addLast(waiter);
        }

        // A cancelled (or otherwise abandoned) request leaves the queue
        waiter.whenComplete((permit, error) -> {
            if (error != null) {
                synchronized (lock) {
                    waiters.remove(waiter);
                }
            }
        });
        return waiter;
    }

    private void releaseSlot() {
        while (true) {
            CompletableFuture<Permit> next;
            synchronized (lock) {
                next = waiters.pollFirst();
                if (next == null) {
                    active--;
                    return;
                }
            }
            // Slot passes straight to the next waiter; active count is unchanged
            if (next.complete(new Permit())) {
                return;
            }
        }
    }

    /**
     * @return the ceiling, or null when unbounded
     */
    public Integer getMaxConcurrency() {
        return maxConcurrency;
    }

    /**
     * @return number of permits currently held (including slots in hand-off)
     */
    public int getActiveCount() {
        synchronized (lock) {
            return active;
        }
    }

    /**
     * @return number of acquire requests waiting for a slot
     */
    public int getWaitingCount() {
        synchronized (lock) {
            return waiters.size();
        }
    }

    @Override
    public String toString() {
        synchronized (lock) {
            return "ConcurrencyLimiter{" +
                    "max=" + (maxConcurrency == null ? "unbounded" : maxConcurrency) +
                    ", active=" + active +
                    ", waiting=" + waiters.size() +
                    '}';
        }
    }

    /**
     * One granted slot. Always returns to the limiter that issued it, even if the
     * scheduler has since switched to a different limiter.
     */
    public final class Permit implements AutoCloseable {
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit() {
        }

        /**
         * Give the slot back. Only the first call has an effect.
         *
         * @return true if this call released the slot
         */
        public boolean release() {
            if (released.compareAndSet(false, true)) {
                releaseSlot();
                return true;
            }
            return false;
        }

        public boolean isReleased() {
            return released.get();
        }

        @Override
        public void close() {
            release();
        }
    }
}
