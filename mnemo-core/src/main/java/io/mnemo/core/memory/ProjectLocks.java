package io.mnemo.core.memory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One writer lock per project. Engine instances that share a {@code ProjectLocks}
 * serialize their mutations of the same project.
 */
public final class ProjectLocks {
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock lockFor(String projectId) {
        return locks.computeIfAbsent(projectId, ignored -> new ReentrantLock());
    }
}
