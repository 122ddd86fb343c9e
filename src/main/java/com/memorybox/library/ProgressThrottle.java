package com.memorybox.library;

/**
 * Forwards a percentage to the reporter only when it grows, so a scan of many small items does
 * not call back once per item.
 */
class ProgressThrottle {
    private final ProgressReporter reporter;
    private int lastReported = -1;

    ProgressThrottle(ProgressReporter reporter) {
        this.reporter = reporter == null ? ProgressReporter.NONE : reporter;
    }

    void update(int processed, int total) {
        int percent = total <= 0 ? 100 : (int) ((long) processed * 100 / total);
        emit(Math.min(100, percent));
    }

    void complete() {
        emit(100);
    }

    int lastReported() {
        return lastReported;
    }

    private void emit(int percent) {
        if (percent > lastReported) {
            lastReported = percent;
            reporter.report(percent);
        }
    }
}
