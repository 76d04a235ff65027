package com.llestrade.core.storage;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per output path so two jobs never interleave writes to the same file or sidecar.
 * A path's lock lives only while some thread holds or waits for it.
 */
@Component
public class PathLocks {

    private final ConcurrentHashMap<Path, PathLock> locks = new ConcurrentHashMap<>();

    @FunctionalInterface
    public interface IoAction<T> {
        T run() throws IOException;
    }

    public <T> T withLock(Path path, IoAction<T> action) throws IOException {
        Path key = path.toAbsolutePath().normalize();
        // users is only touched inside compute/computeIfPresent, which serialise per key
        PathLock entry = locks.compute(key, (k, existing) -> {
            PathLock held = existing != null ? existing : new PathLock();
            held.users++;
            return held;
        });
        entry.lock.lock();
        try {
            return action.run();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(key, (k, held) -> --held.users == 0 ? null : held);
        }
    }

    /** Paths with a live lock. */
    int size() {
        return locks.size();
    }

    private static final class PathLock {
        final ReentrantLock lock = new ReentrantLock();
        int users;
    }
}
