package org.lite.notify.scheduler;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per task id, held for a whole firing. Entries are reference
 * counted and disappear once nobody holds or waits on them.
 */
@Component
public class TaskLockManager {

    private final ConcurrentHashMap<String, LockEntry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String taskId, Supplier<T> action) {
        LockEntry entry = acquire(taskId);
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            release(taskId);
        }
    }

    public void runLocked(String taskId, Runnable action) {
        withLock(taskId, () -> {
            action.run();
            return null;
        });
    }

    public int activeLocks() {
        return locks.size();
    }

    private LockEntry acquire(String taskId) {
        return locks.compute(taskId, (id, existing) -> {
            LockEntry entry = existing == null ? new LockEntry() : existing;
            entry.references++;
            return entry;
        });
    }

    private void release(String taskId) {
        locks.computeIfPresent(taskId, (id, entry) -> --entry.references == 0 ? null : entry);
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        private int references;     // guarded by the map's per-key compute
    }
}
