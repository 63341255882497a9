package com.incident.dedup.lock;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.TreeSet;

/**
 * Holds locks on a set of record ids, acquired in sorted order so two callers locking the
 * same pair can never deadlock. Releases in reverse order on close.
 *
 * <pre>
 * try (RecordLocks held = RecordLocks.acquire(lock, primaryId, secondaryId)) {
 *     // write phase
 * }
 * </pre>
 */
public final class RecordLocks implements AutoCloseable {

    private final DistributedLock lock;
    private final Deque<String> held = new ArrayDeque<>();

    private RecordLocks(DistributedLock lock) {
        this.lock = lock;
    }

    /**
     * Acquires all ids or none: if one acquisition fails the ones already held are released.
     *
     * @throws LockAcquisitionException if any lock cannot be acquired
     */
    public static RecordLocks acquire(DistributedLock lock, String... recordIds) {
        RecordLocks locks = new RecordLocks(lock);
        try {
            for (String id : new TreeSet<>(Arrays.asList(recordIds))) {
                if (!lock.tryLock(id)) {
                    throw new LockAcquisitionException("Lock not granted for record " + id);
                }
                locks.held.push(id);
            }
        } catch (RuntimeException e) {
            locks.close();
            throw e;
        }
        return locks;
    }

    @Override
    public void close() {
        while (!held.isEmpty()) {
            lock.unlock(held.pop());
        }
    }
}
