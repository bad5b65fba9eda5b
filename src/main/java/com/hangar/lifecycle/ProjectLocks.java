package com.hangar.lifecycle;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One re-entrant lock per project id, so that lifecycle operations on the
 * same project never interleave (a backup cannot race a stop), while
 * different projects proceed in parallel.
 */
@Component
public class ProjectLocks {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String projectId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(projectId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void release(String projectId) {
        locks.remove(projectId);
    }
}
