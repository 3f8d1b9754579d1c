package com.flightledger.ledger.service;

import com.flightledger.ledger.config.LedgerProperties;
import com.flightledger.ledger.service.lock.LockOperations;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One fair {@link ReentrantLock} per flight, held only for the duration of a single action.
 */
@Service
@Slf4j
public class InMemoryLockService implements LockOperations {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Duration waitTimeout;

    public InMemoryLockService(LedgerProperties properties) {
        this.waitTimeout = properties.getLock().getWaitTimeout();
    }

    @Override
    public <T> T executeWithLock(String resourceId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(resourceId, id -> new ReentrantLock(true));

        boolean acquired;
        try {
            acquired = lock.tryLock(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Lock acquisition interrupted: flightId={}", resourceId);
            throw new LockAcquisitionException("Interrupted while waiting for lock on flight: " + resourceId);
        }

        if (!acquired) {
            log.warn("Failed to acquire lock within timeout: flightId={}, waitTimeout={}ms",
                    resourceId, waitTimeout.toMillis());
            throw new LockAcquisitionException("Failed to acquire lock for flight: " + resourceId);
        }

        log.debug("Acquired lock: flightId={}", resourceId);
        try {
            return action.get();
        } finally {
            lock.unlock();
            log.debug("Released lock: flightId={}", resourceId);
        }
    }

    @Override
    public void discardLock(String resourceId) {
        ReentrantLock kept = locks.computeIfPresent(resourceId,
                (id, lock) -> lock.isLocked() || lock.hasQueuedThreads() ? lock : null);
        if (kept != null) {
            log.debug("Lock still in use, not discarded: flightId={}", resourceId);
        }
    }

    int lockCount() {
        return locks.size();
    }
}
