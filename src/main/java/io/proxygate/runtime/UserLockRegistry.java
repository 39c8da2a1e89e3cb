package io.proxygate.runtime;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per user id. Entries are reference counted and dropped when the last holder or waiter
 * releases, so the map only holds users with work in flight.
 */
public final class UserLockRegistry {
    private final ConcurrentMap<String, Entry> locks = new ConcurrentHashMap<>();

    public Handle acquire(String userId) {
        Entry entry = locks.compute(userId, (ignored, existing) -> {
            Entry e = existing == null ? new Entry() : existing;
            e.refs++;
            return e;
        });
        entry.lock.lock();
        return new Handle(userId, entry);
    }

    public int size() {
        return locks.size();
    }

    private void release(String userId, Entry entry) {
        entry.lock.unlock();
        locks.computeIfPresent(userId, (ignored, existing) -> {
            if (existing != entry) {
                return existing;
            }
            existing.refs--;
            return existing.refs <= 0 ? null : existing;
        });
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        // Guarded by the map's per-key compute.
        private int refs;
    }

    public final class Handle implements AutoCloseable {
        private final String userId;
        private final Entry entry;
        private boolean released;

        private Handle(String userId, Entry entry) {
            this.userId = userId;
            this.entry = entry;
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            release(userId, entry);
        }
    }
}
