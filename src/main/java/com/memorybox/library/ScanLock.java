package com.memorybox.library;

import java.util.concurrent.Semaphore;

import com.memorybox.error.LockContentionException;

/**
 * Non-blocking, non-reentrant mutex for the operations that rewrite a library. Acquisition
 * never waits: a second caller gets {@link LockContentionException} right away.
 */
public class ScanLock {
    private final Semaphore permit = new Semaphore(1);

    public Guard acquire(String operation) {
        if (!permit.tryAcquire()) {
            throw new LockContentionException("Cannot " + operation + ": a scan is already running on this library");
        }
        return new Guard();
    }

    public boolean isHeld() {
        return permit.availablePermits() == 0;
    }

    public final class Guard implements AutoCloseable {
        private boolean released;

        private Guard() {
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                permit.release();
            }
        }
    }
}
