package de.mirkosertic.mcp.medialibrary.job;

import de.mirkosertic.mcp.medialibrary.config.ApplicationConfig;
import de.mirkosertic.mcp.medialibrary.library.LibraryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process job queue on a bounded thread pool.
 * <p>
 * Delivery is at-least-once: a handler failing with anything but a {@link LibraryException} is
 * retried after a fixed backoff until {@code maxAttempts} is reached. A {@link LibraryException}
 * describes a permanent condition and is never retried. Jobs without a registered handler are
 * counted and dropped. Work that is rejected or still waiting for a retry when the queue shuts
 * down is counted as failed.
 */
public class ExecutorJobQueue implements JobQueue {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorJobQueue.class);

    private final ThreadPoolExecutor executor;
    private final ScheduledExecutorService retryScheduler;
    private final Map<JobName, JobHandler<Object>> handlers = new ConcurrentHashMap<>();
    private final JobStatisticsTracker statistics;
    private final int maxAttempts;
    private final long retryBackoffMs;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final Set<PendingRetry> pendingRetries = ConcurrentHashMap.newKeySet();

    public ExecutorJobQueue(final ApplicationConfig config, final JobStatisticsTracker statistics) {
        this(config.getThreadPoolSize(), config.getQueueCapacity(), config.getMaxAttempts(),
                config.getRetryBackoffMs(), statistics);
    }

    public ExecutorJobQueue(final int threadPoolSize, final int queueCapacity, final int maxAttempts,
                            final long retryBackoffMs, final JobStatisticsTracker statistics) {
        this.statistics = statistics;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryBackoffMs = retryBackoffMs;

        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "job-worker-" + threadCounter.getAndIncrement());
            thread.setDaemon(false);
            return thread;
        };

        this.executor = new ThreadPoolExecutor(
                threadPoolSize,
                threadPoolSize,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                threadFactory,
                // Caller runs while the queue is full, but nothing is silently dropped after shutdown
                (task, pool) -> {
                    if (pool.isShutdown()) {
                        throw new RejectedExecutionException("Job queue is shut down");
                    }
                    task.run();
                }
        );
        this.retryScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "job-retry");
            t.setDaemon(true);
            return t;
        });

        logger.info("Job queue initialized with {} threads, capacity {}, max attempts {}",
                threadPoolSize, queueCapacity, this.maxAttempts);
    }

    @SuppressWarnings("unchecked")
    public <T> void register(final JobName name, final JobHandler<T> handler) {
        handlers.put(name, (JobHandler<Object>) handler);
        logger.debug("Registered handler for {}", name);
    }

    @Override
    public void enqueue(final JobName name, final Object payload) {
        if (!name.payloadType().isInstance(payload)) {
            throw new IllegalArgumentException("Job " + name + " expects a " + name.payloadType().getSimpleName()
                    + " payload, got " + (payload == null ? "null" : payload.getClass().getSimpleName()));
        }
        statistics.enqueued(name);

        final JobHandler<Object> handler = handlers.get(name);
        if (handler == null) {
            logger.debug("No handler registered for {}, dropping {}", name, payload);
            statistics.unhandled(name);
            return;
        }
        submit(name, payload, handler, 1);
    }

    private void submit(final JobName name, final Object payload, final JobHandler<Object> handler, final int attempt) {
        inFlight.incrementAndGet();
        try {
            executor.execute(() -> {
                try {
                    run(name, payload, handler, attempt);
                } finally {
                    inFlight.decrementAndGet();
                }
            });
        } catch (final RejectedExecutionException e) {
            inFlight.decrementAndGet();
            logger.warn("Job {} rejected for {}: {}", name, payload, e.getMessage());
            statistics.failed(name, payload, e.getMessage());
        }
    }

    private void scheduleRetry(final PendingRetry retry) {
        inFlight.incrementAndGet();
        pendingRetries.add(retry);
        try {
            retryScheduler.schedule(() -> {
                if (pendingRetries.remove(retry)) {
                    try {
                        submit(retry.name(), retry.payload(), retry.handler(), retry.attempt());
                    } finally {
                        inFlight.decrementAndGet();
                    }
                }
            }, retryBackoffMs, TimeUnit.MILLISECONDS);
        } catch (final RejectedExecutionException e) {
            dropRetry(retry);
        }
    }

    private void dropRetry(final PendingRetry retry) {
        if (pendingRetries.remove(retry)) {
            inFlight.decrementAndGet();
            logger.warn("Job {} dropped before retry attempt {} for {}: queue is shut down",
                    retry.name(), retry.attempt(), retry.payload());
            statistics.failed(retry.name(), retry.payload(), "Job queue shut down before retry");
        }
    }

    private void run(final JobName name, final Object payload, final JobHandler<Object> handler, final int attempt) {
        try {
            if (handler.handle(payload)) {
                statistics.completed(name);
            } else {
                logger.warn("Job {} was not handled for {}", name, payload);
                statistics.failed(name, payload, "Handler returned false");
            }
        } catch (final LibraryException e) {
            logger.error("Job {} failed for {}: {}", name, payload, e.getMessage());
            statistics.failed(name, payload, e.getMessage());
        } catch (final Exception e) {
            if (attempt < maxAttempts && !executor.isShutdown()) {
                logger.warn("Job {} attempt {}/{} failed for {}, retrying in {}ms: {}",
                        name, attempt, maxAttempts, payload, retryBackoffMs, e.getMessage());
                statistics.retried(name);
                scheduleRetry(new PendingRetry(name, payload, handler, attempt + 1));
            } else {
                logger.error("Job {} failed after {} attempts for {}", name, attempt, payload, e);
                statistics.failed(name, payload, String.valueOf(e.getMessage()));
            }
        }
    }

    /**
     * Wait until no job is queued, running or waiting for a retry.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitIdle(final long timeout, final TimeUnit unit) throws InterruptedException {
        final long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (inFlight.get() > 0) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(10);
        }
        return true;
    }

    public JobStatistics getStatistics() {
        return statistics.snapshot(executor.getQueue().size(), executor.getActiveCount());
    }

    /**
     * Shutdown the queue. Should be called on application shutdown.
     */
    public void shutdown() {
        logger.info("Shutting down job queue");
        retryScheduler.shutdownNow();
        for (final PendingRetry retry : pendingRetries) {
            dropRetry(retry);
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Job queue did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for the job queue to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // Identity equality, two retries of equal payloads are distinct entries
    private static final class PendingRetry {

        private final JobName name;
        private final Object payload;
        private final JobHandler<Object> handler;
        private final int attempt;

        PendingRetry(final JobName name, final Object payload, final JobHandler<Object> handler, final int attempt) {
            this.name = name;
            this.payload = payload;
            this.handler = handler;
            this.attempt = attempt;
        }

        JobName name() {
            return name;
        }

        Object payload() {
            return payload;
        }

        JobHandler<Object> handler() {
            return handler;
        }

        int attempt() {
            return attempt;
        }
    }
}
