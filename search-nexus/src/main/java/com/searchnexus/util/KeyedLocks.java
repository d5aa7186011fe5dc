package com.searchnexus.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One exclusive lock per key. Multi-key acquisition always happens in sorted
 * order so two callers locking overlapping key sets cannot deadlock. A key's
 * entry is dropped once no caller holds or waits for it.
 */
public class KeyedLocks {

    private final Map<String, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String key, Supplier<T> action) {
        return withLocks(List.of(key), action);
    }

    public <T> T withLocks(Collection<String> keys, Supplier<T> action) {
        List<String> ordered = keys.stream()
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .toList();
        List<String> retained = new ArrayList<>();
        List<Entry> held = new ArrayList<>();
        try {
            for (String key : ordered) {
                Entry entry = retain(key);
                retained.add(key);
                entry.lock.lock();
                held.add(entry);
            }
            return action.get();
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) {
                held.get(i).lock.unlock();
            }
            for (String key : retained) {
                release(key);
            }
        }
    }

    public boolean isLocked(String key) {
        Entry entry = locks.get(key);
        return entry != null && entry.lock.isLocked();
    }

    int size() {
        return locks.size();
    }

    private Entry retain(String key) {
        return locks.compute(key, (k, existing) -> {
            Entry entry = existing != null ? existing : new Entry();
            entry.users++;
            return entry;
        });
    }

    private void release(String key) {
        locks.computeIfPresent(key, (k, entry) -> --entry.users == 0 ? null : entry);
    }

    // users is only read and written inside compute calls for its key
    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
