package de.mirkosertic.mcp.medialibrary.job;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts what happens to jobs, per job name. Thread-safe for use from all worker threads.
 */
public class JobStatisticsTracker {

    private static final int MAX_RECENT_FAILURES = 50;

    private final Map<JobName, Counters> counters = new EnumMap<>(JobName.class);
    private final Deque<JobStatistics.Failure> recentFailures = new ArrayDeque<>();

    public JobStatisticsTracker() {
        for (final JobName name : JobName.values()) {
            counters.put(name, new Counters());
        }
    }

    public void enqueued(final JobName name) {
        counters.get(name).enqueued.incrementAndGet();
    }

    public void completed(final JobName name) {
        counters.get(name).completed.incrementAndGet();
    }

    public void retried(final JobName name) {
        counters.get(name).retried.incrementAndGet();
    }

    public void unhandled(final JobName name) {
        counters.get(name).unhandled.incrementAndGet();
    }

    public void failed(final JobName name, final Object payload, final String message) {
        counters.get(name).failed.incrementAndGet();
        synchronized (recentFailures) {
            recentFailures.addFirst(new JobStatistics.Failure(name, payload, message, System.currentTimeMillis()));
            while (recentFailures.size() > MAX_RECENT_FAILURES) {
                recentFailures.removeLast();
            }
        }
    }

    public JobStatistics snapshot(final int queuedTasks, final int activeWorkers) {
        final Map<JobName, JobStatistics.Counts> perJob = new EnumMap<>(JobName.class);
        counters.forEach((name, c) -> perJob.put(name, c.toCounts()));
        final List<JobStatistics.Failure> failures;
        synchronized (recentFailures) {
            failures = new ArrayList<>(recentFailures);
        }
        return new JobStatistics(Map.copyOf(perJob), List.copyOf(failures), queuedTasks, activeWorkers);
    }

    private static final class Counters {
        final AtomicLong enqueued = new AtomicLong();
        final AtomicLong completed = new AtomicLong();
        final AtomicLong failed = new AtomicLong();
        final AtomicLong retried = new AtomicLong();
        final AtomicLong unhandled = new AtomicLong();

        JobStatistics.Counts toCounts() {
            return new JobStatistics.Counts(enqueued.get(), completed.get(), failed.get(),
                    retried.get(), unhandled.get());
        }
    }
}
