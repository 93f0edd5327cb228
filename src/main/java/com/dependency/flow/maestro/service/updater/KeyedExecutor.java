package com.dependency.flow.maestro.service.updater;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs work for one key at a time within this process. Different keys run in parallel.
 * A key's lock is held in the map only while some thread uses or waits for it.
 */
@Component
public class KeyedExecutor {

    private final Map<String, KeyLock> locks = new ConcurrentHashMap<>();

    public <T> T execute(String key, Supplier<T> work) {
        KeyLock keyLock = locks.compute(key, (k, existing) -> {
            KeyLock acquired = existing != null ? existing : new KeyLock();
            acquired.users++;
            return acquired;
        });
        keyLock.lock.lock();
        try {
            return work.get();
        } finally {
            keyLock.lock.unlock();
            locks.computeIfPresent(key, (k, existing) -> --existing.users == 0 ? null : existing);
        }
    }

    int activeKeys() {
        return locks.size();
    }

    // users is only read and written inside compute for the same key
    private static final class KeyLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
