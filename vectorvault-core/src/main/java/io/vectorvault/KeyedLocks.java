package io.vectorvault;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Advisory locks keyed by collection id. Locks for several ids are always acquired in
 * id order, so two callers locking overlapping sets cannot deadlock.
 *
 * <p>An id has an entry only while some thread holds or waits for its lock; the entry is
 * dropped when the last holder releases it.</p>
 */
public class KeyedLocks {

    private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();

    /**
     * Blocks until every id in {@code ids} is locked by the current thread.
     *
     * @return a handle that releases all of them when closed
     */
    public Handle lockAll(Collection<String> ids) {
        List<String> acquired = new ArrayList<>();
        try {
            for (String id : new TreeSet<>(ids)) {
                Entry entry = locks.compute(id, (k, existing) -> {
                    Entry e = existing != null ? existing : new Entry();
                    e.holders++;
                    return e;
                });
                try {
                    entry.lock.lock();
                } catch (RuntimeException | Error e) {
                    release(id, false);
                    throw e;
                }
                acquired.add(id);
            }
        } catch (RuntimeException | Error e) {
            new Handle(this, acquired).close();
            throw e;
        }
        return new Handle(this, acquired);
    }

    public Handle lock(String id) {
        return lockAll(List.of(id));
    }

    /**
     * Whether some thread currently holds the lock for {@code id}.
     */
    public boolean isLocked(String id) {
        Entry entry = locks.get(id);
        return entry != null && entry.lock.isLocked();
    }

    /**
     * Number of ids with a live entry.
     */
    public int size() {
        return locks.size();
    }

    private void release(String id, boolean unlock) {
        locks.computeIfPresent(id, (k, entry) -> {
            if (unlock) {
                entry.lock.unlock();
            }
            return --entry.holders == 0 ? null : entry;
        });
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();

        /** Threads holding or waiting, counted once per acquisition; guarded by the map */
        private int holders;
    }

    /**
     * Releases a set of locks taken together.
     */
    public static final class Handle implements AutoCloseable {
        private final KeyedLocks owner;
        private final List<String> held;

        private Handle(KeyedLocks owner, List<String> held) {
            this.owner = owner;
            this.held = held;
        }

        @Override
        public void close() {
            for (int i = held.size() - 1; i >= 0; i--) {
                owner.release(held.get(i), true);
            }
        }
    }
}
