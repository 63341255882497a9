package com.incident.dedup.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-JVM lock backed by one {@link ReentrantLock} per record id.
 * Each attempt waits up to the configured timeout; failed attempts are retried after a delay.
 *
 * <p>A record's entry counts the threads holding or waiting for it and is dropped when that
 * count reaches zero, so only records currently in use are tracked.</p>
 */
public class LocalDistributedLock implements DistributedLock {
    private static final Logger log = LoggerFactory.getLogger(LocalDistributedLock.class);

    private final ConcurrentHashMap<String, LockEntry> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalDistributedLock() {
        this(LockConfig.defaults());
    }

    public LocalDistributedLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public boolean tryLock(String key) {
        LockEntry entry = retain(key);
        try {
            for (int attempt = 0; attempt <= config.maxRetries(); attempt++) {
                if (entry.lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS)) {
                    log.debug("lock.acquired key={} attempt={}", key, attempt);
                    return true;
                }
                if (attempt < config.maxRetries()) {
                    Thread.sleep(config.retryDelayMs());
                }
            }
        } catch (InterruptedException e) {
            release(key);
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock for record " + key, e);
        }
        release(key);
        throw new LockAcquisitionException("Failed to acquire lock for record " + key
                + " after " + (config.maxRetries() + 1) + " attempts of " + config.timeoutMs() + "ms");
    }

    @Override
    public void unlock(String key) {
        LockEntry entry = locks.get(key);
        if (entry != null && entry.lock.isHeldByCurrentThread()) {
            entry.lock.unlock();
            release(key);
            log.debug("lock.released key={}", key);
        }
    }

    public boolean isLocked(String key) {
        LockEntry entry = locks.get(key);
        return entry != null && entry.lock.isLocked();
    }

    /**
     * Number of records with a holder or waiter.
     */
    int trackedKeys() {
        return locks.size();
    }

    private LockEntry retain(String key) {
        return locks.compute(key, (k, entry) -> {
            LockEntry current = entry != null ? entry : new LockEntry();
            current.users++;
            return current;
        });
    }

    private void release(String key) {
        locks.computeIfPresent(key, (k, entry) -> --entry.users == 0 ? null : entry);
    }

    // users is only read and written inside compute on the owning key
    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
