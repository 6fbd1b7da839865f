package de.mirkosertic.mcp.medialibrary.job;

import java.util.List;
import java.util.Map;

/**
 * Snapshot of the job queue counters.
 */
public record JobStatistics(
        Map<JobName, Counts> perJob,
        List<Failure> recentFailures,
        int queuedTasks,
        int activeWorkers
) {

    public record Counts(
            long enqueued,
            long completed,
            long failed,
            long retried,
            long unhandled
    ) {
    }

    /** A job that failed permanently. */
    public record Failure(JobName name, Object payload, String message, long timestampMs) {
    }
}
