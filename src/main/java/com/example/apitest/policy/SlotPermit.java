package com.example.apitest.policy;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A held concurrency slot. Closing it more than once releases the slot only once.
 */
public final class SlotPermit implements AutoCloseable {
    private static final SlotPermit UNBOUNDED = new SlotPermit(null);

    private final Semaphore semaphore;
    private final AtomicBoolean released = new AtomicBoolean(false);

    private SlotPermit(Semaphore semaphore) {
        this.semaphore = semaphore;
    }

    static SlotPermit acquire(Semaphore semaphore) throws InterruptedException {
        semaphore.acquire();
        return new SlotPermit(semaphore);
    }

    static SlotPermit unbounded() {
        return UNBOUNDED;
    }

    @Override
    public void close() {
        if (semaphore != null && released.compareAndSet(false, true)) {
            semaphore.release();
        }
    }
}
