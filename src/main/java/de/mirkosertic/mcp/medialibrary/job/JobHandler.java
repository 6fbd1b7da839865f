package de.mirkosertic.mcp.medialibrary.job;

import java.io.IOException;

@FunctionalInterface
public interface JobHandler<T> {

    /**
     * Process one job.
     *
     * @return true once the job is handled, false if the handler gave up on it
     * @throws IOException on transient failures, the job is retried
     */
    boolean handle(T payload) throws IOException;
}
