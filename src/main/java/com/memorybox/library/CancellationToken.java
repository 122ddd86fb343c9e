package com.memorybox.library;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancel signal. A scan polls it once per item and never interrupts an item that
 * is already being embedded or written.
 */
public class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
