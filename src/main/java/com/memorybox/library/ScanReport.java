package com.memorybox.library;

public record ScanReport(
        ScanMode mode,
        ScanStatus status,
        int discoveredFiles,
        int embeddedFiles,
        int removedFiles,
        int invalidFiles) {

    public enum ScanMode {
        FULL,
        INCREMENTAL
    }

    public enum ScanStatus {
        COMPLETED,
        /** The library was already initialized; nothing was written. */
        UP_TO_DATE,
        /** Cancelled by the caller; every write of the scan has been rolled back. */
        CANCELLED
    }

    static ScanReport upToDate() {
        return new ScanReport(ScanMode.FULL, ScanStatus.UP_TO_DATE, 0, 0, 0, 0);
    }

    public boolean cancelled() {
        return status == ScanStatus.CANCELLED;
    }
}
