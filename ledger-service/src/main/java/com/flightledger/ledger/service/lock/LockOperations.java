package com.flightledger.ledger.service.lock;

import java.util.function.Supplier;

/**
 * Serializes access to a single flight ledger.
 * Implementations decide where the lock lives (in-process, Redis, ZooKeeper).
 */
public interface LockOperations {

    /**
     * Executes action while holding the lock on one resource.
     *
     * @param resourceId Resource to lock
     * @param action Action to execute while holding lock
     * @return Result of action
     * @throws LockAcquisitionException if lock cannot be acquired
     */
    <T> T executeWithLock(String resourceId, Supplier<T> action);

    /**
     * Forgets the lock of a resource that no longer exists.
     * A lock that is still held or waited on is kept; its last user discards it.
     */
    void discardLock(String resourceId);

    class LockAcquisitionException extends RuntimeException {
        public LockAcquisitionException(String message) {
            super(message);
        }
    }
}
