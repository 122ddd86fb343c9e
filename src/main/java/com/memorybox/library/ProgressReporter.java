package com.memorybox.library;

@FunctionalInterface
public interface ProgressReporter {
    ProgressReporter NONE = percent -> {
    };

    /** @param percent 0..100, never lower than the previous value of the same scan */
    void report(int percent);
}
