package com.tixgo.catalog.service;

import java.time.Duration;

public interface DistributedLockService {

    /**
     * Acquire a distributed lock with automatic expiry
     *
     * @param lockKey The key for the lock
     * @param timeout Lock timeout duration
     * @return Lock token if successful, null if failed
     */
    String acquireLock(String lockKey, Duration timeout);

    /**
     * Release a distributed lock
     *
     * @param lockKey The key for the lock
     * @param lockToken The token that was returned when acquiring the lock
     * @return true if successfully released, false otherwise
     */
    boolean releaseLock(String lockKey, String lockToken);

    /**
     * Execute a task while holding a distributed lock, retrying a busy lock a bounded
     * number of times
     *
     * @throws com.tixgo.common.exception.MarketplaceException with kind UNAVAILABLE if the lock
     *         is still busy after the last attempt
     */
    <T> T executeWithLock(String lockKey, Duration timeout, DistributedTask<T> task);

    @FunctionalInterface
    interface DistributedTask<T> {
        T execute();
    }

    /**
     * Single lock guarding the pool of advertisement slots
     */
    static String advertiseSlotsLock() {
        return "advertise_slots";
    }
}
