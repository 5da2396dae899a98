package com.vtb.vulnpolicy.severity;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Кэш результатов поиска по каноническому ID на время одного прогона.
 * Чтения идут параллельно, запись эксклюзивна.
 */
class SeverityCache {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, LookupOutcome> entries = new HashMap<>();

    Optional<LookupOutcome> get(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    void put(String id, LookupOutcome outcome) {
        lock.writeLock().lock();
        try {
            entries.put(id, outcome);
        } finally {
            lock.writeLock().unlock();
        }
    }

    int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
