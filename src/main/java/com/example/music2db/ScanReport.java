package com.example.music2db;

public record ScanReport(
        Status status,
        long candidateFiles,
        long tracksQueued,
        int batchesDelivered,
        int batchesFailed,
        boolean checkpointSaved
) {
    public enum Status {
        SKIPPED_NO_CHANGES,
        SKIPPED_UNHEALTHY,
        SKIPPED_MISSING_ROOT,
        CANCELLED,
        COMPLETED,
        COMPLETED_WITH_FAILURES
    }

    public static ScanReport skipped(Status status) {
        return new ScanReport(status, 0, 0, 0, 0, false);
    }
}
