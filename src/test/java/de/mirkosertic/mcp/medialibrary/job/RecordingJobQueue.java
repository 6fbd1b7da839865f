package de.mirkosertic.mcp.medialibrary.job;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Job queue that only records what was enqueued.
 */
public class RecordingJobQueue implements JobQueue {

    public record Entry(JobName name, Object payload) {
    }

    private final List<Entry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void enqueue(final JobName name, final Object payload) {
        if (!name.payloadType().isInstance(payload)) {
            throw new IllegalArgumentException("Wrong payload for " + name);
        }
        entries.add(new Entry(name, payload));
    }

    public List<Entry> entries() {
        return entries;
    }

    @SuppressWarnings("unchecked")
    public <T> List<T> payloads(final JobName name) {
        return entries.stream()
                .filter(entry -> entry.name() == name)
                .map(entry -> (T) entry.payload())
                .toList();
    }
}
