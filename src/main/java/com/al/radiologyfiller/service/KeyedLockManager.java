package com.al.radiologyfiller.service;

import com.al.radiologyfiller.config.RadiologyProperties;
import com.al.radiologyfiller.exception.ConcurrencyConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-key mutual exclusion with a bounded wait. Locks exist only while someone holds or waits for
 * them. Keys are acquired in the order given, so callers must always pass them in the same order.
 * <p>
 * This serializes work inside one JVM; across nodes the unique indexes on the stored documents are
 * the final arbiter.
 */
@Slf4j
@Component
public class KeyedLockManager {

    private final Map<String, RefCountedLock> locks = new ConcurrentHashMap<>();
    private final RadiologyProperties properties;

    public KeyedLockManager(RadiologyProperties properties) {
        this.properties = properties;
    }

    public <T> T withLocks(List<String> keys, Supplier<T> action) {
        return withLocks(keys, 0, action);
    }

    private <T> T withLocks(List<String> keys, int index, Supplier<T> action) {
        if (index == keys.size()) {
            return action.get();
        }
        String key = keys.get(index);
        RefCountedLock lock = acquire(key);
        try {
            return withLocks(keys, index + 1, action);
        } finally {
            release(key, lock);
        }
    }

    private RefCountedLock acquire(String key) {
        RefCountedLock lock = locks.compute(key, (k, existing) -> {
            RefCountedLock l = existing == null ? new RefCountedLock() : existing;
            l.users++;
            return l;
        });
        long timeoutMillis = properties.getLockTimeout().toMillis();
        boolean acquired;
        try {
            acquired = lock.lock.tryLock(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            unregister(key);
            throw new ConcurrencyConflictException("Interrupted while waiting for " + key, e);
        }
        if (!acquired) {
            unregister(key);
            log.warn("Timed out after {} ms waiting for {}", timeoutMillis, key);
            throw new ConcurrencyConflictException("Timed out waiting for " + key);
        }
        return lock;
    }

    private void release(String key, RefCountedLock lock) {
        lock.lock.unlock();
        unregister(key);
    }

    private void unregister(String key) {
        locks.computeIfPresent(key, (k, l) -> --l.users == 0 ? null : l);
    }

    int activeKeys() {
        return locks.size();
    }

    private static final class RefCountedLock {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's compute
        private int users;
    }
}
