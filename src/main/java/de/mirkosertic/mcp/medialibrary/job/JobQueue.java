package de.mirkosertic.mcp.medialibrary.job;

/**
 * Fire-and-forget submission of background work. Jobs run in no particular order and may be
 * delivered more than once.
 */
public interface JobQueue {

    /**
     * @throws IllegalArgumentException if the payload does not match {@link JobName#payloadType()}
     */
    void enqueue(JobName name, Object payload);
}
