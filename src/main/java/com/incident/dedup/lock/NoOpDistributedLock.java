package com.incident.dedup.lock;

/**
 * Lock that always succeeds immediately. Default for single-worker batch runs.
 */
public class NoOpDistributedLock implements DistributedLock {

    @Override
    public boolean tryLock(String key) {
        return true;
    }

    @Override
    public void unlock(String key) {
        // no-op
    }
}
