package com.incident.dedup.lock;

/**
 * Lock over record ids that serializes the write phase of merges touching the same record,
 * whether they come from concurrent deduplication runs or ingest-time matching.
 */
public interface DistributedLock {

    /**
     * Acquires the lock on the given key.
     *
     * @param key the lock key, a record id
     * @return true once the lock is held
     * @throws LockAcquisitionException if the lock cannot be acquired within the configured budget
     */
    boolean tryLock(String key);

    /**
     * Releases the lock on the given key if the caller holds it.
     */
    void unlock(String key);
}
