package de.mirkosertic.mcp.medialibrary.worker;

import com.google.common.util.concurrent.Striped;

import java.util.concurrent.locks.Lock;

/**
 * Mutual exclusion per (library, path), shared by both file workers so that a refresh and an
 * offline job for the same file never interleave their read-decide-write sequences.
 */
public class PathLockRegistry {

    private final Striped<Lock> locks;

    public PathLockRegistry() {
        this(256);
    }

    public PathLockRegistry(final int stripes) {
        this.locks = Striped.lazyWeakLock(stripes);
    }

    public Lock lockFor(final String libraryId, final String path) {
        return locks.get(libraryId + '\u0000' + path);
    }
}
