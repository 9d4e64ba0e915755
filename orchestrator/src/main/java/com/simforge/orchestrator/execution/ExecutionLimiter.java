package com.simforge.orchestrator.execution;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Caps how many artifacts run in the external environment at once across
 * all jobs. Fair, so waiting jobs are served in arrival order.
 *
 * A slot is handed out as a {@link Permit}. The stage holds one reference;
 * each external call made under the permit holds another through
 * {@link Permit#share()}. The slot goes back to the pool when the last
 * reference is released, so a call that outlives its deadline keeps the slot
 * until it has actually finished.
 */
public class ExecutionLimiter {

    private final int       capacity;
    private final Semaphore permits;

    public ExecutionLimiter(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
        this.permits  = new Semaphore(capacity, true);
    }

    /** Blocks until a slot is free. */
    public Permit acquire() throws InterruptedException {
        permits.acquire();
        return new Permit();
    }

    public int capacity() {
        return capacity;
    }

    /** Slots currently held, by a stage or by a call still running after its deadline. */
    public int heldCount() {
        return capacity - permits.availablePermits();
    }

    public final class Permit implements AutoCloseable {

        private final AtomicInteger references = new AtomicInteger(1);
        private final AtomicBoolean closed     = new AtomicBoolean();

        private Permit() {}

        /**
         * Adds a reference and returns its release action. The action is
         * idempotent; the slot is freed once it and every other reference are released.
         */
        public Runnable share() {
            references.incrementAndGet();
            AtomicBoolean released = new AtomicBoolean();
            return () -> {
                if (released.compareAndSet(false, true)) {
                    dereference();
                }
            };
        }

        /** Releases the holder's own reference. Idempotent. */
        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                dereference();
            }
        }

        private void dereference() {
            if (references.decrementAndGet() == 0) {
                permits.release();
            }
        }
    }
}
