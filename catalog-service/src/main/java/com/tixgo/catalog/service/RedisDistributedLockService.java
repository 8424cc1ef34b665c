package com.tixgo.catalog.service;

import com.tixgo.common.exception.ErrorKind;
import com.tixgo.common.exception.MarketplaceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.UUID;

/**
 * Redis SET NX lock. {@link #executeWithLock} polls a bounded number of times before giving up,
 * so a short competing critical section delays the caller instead of failing it.
 */
@Service
@Slf4j
public class RedisDistributedLockService implements DistributedLockService {

    private static final String KEY_PREFIX = "tixgo:lock:";

    // Deletes the key only if it still holds our token
    private static final String RELEASE_LOCK_SCRIPT =
        "if redis.call('GET', KEYS[1]) == ARGV[1] then " +
        "  return redis.call('DEL', KEYS[1]) " +
        "else " +
        "  return 0 " +
        "end";

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<Long> releaseLockScript;
    private final int acquireAttempts;
    private final long retryBackoffMillis;

    @Autowired
    public RedisDistributedLockService(StringRedisTemplate redisTemplate,
                                       @Value("${tixgo.lock.acquire-attempts:5}") int acquireAttempts,
                                       @Value("${tixgo.lock.retry-backoff-ms:50}") long retryBackoffMillis) {
        this.redisTemplate = redisTemplate;
        this.releaseLockScript = new DefaultRedisScript<>(RELEASE_LOCK_SCRIPT, Long.class);
        this.acquireAttempts = Math.max(1, acquireAttempts);
        this.retryBackoffMillis = Math.max(0, retryBackoffMillis);
    }

    @Override
    public String acquireLock(String lockKey, Duration timeout) {
        String lockToken = UUID.randomUUID().toString();

        try {
            Boolean acquired = redisTemplate.opsForValue()
                .setIfAbsent(KEY_PREFIX + lockKey, lockToken, timeout);

            if (Boolean.TRUE.equals(acquired)) {
                log.debug("Acquired lock: {} with token: {}", lockKey, lockToken);
                return lockToken;
            }
            log.debug("Lock busy: {}", lockKey);
            return null;
        } catch (Exception e) {
            log.error("Error acquiring lock: {}", lockKey, e);
            return null;
        }
    }

    @Override
    public boolean releaseLock(String lockKey, String lockToken) {
        try {
            Long result = redisTemplate.execute(
                releaseLockScript,
                Collections.singletonList(KEY_PREFIX + lockKey),
                lockToken
            );

            boolean released = result != null && result == 1;
            if (released) {
                log.debug("Released lock: {} with token: {}", lockKey, lockToken);
            } else {
                log.warn("Lock {} expired before release, token {}", lockKey, lockToken);
            }
            return released;
        } catch (Exception e) {
            log.error("Error releasing lock: {} with token: {}", lockKey, lockToken, e);
            return false;
        }
    }

    @Override
    public <T> T executeWithLock(String lockKey, Duration timeout, DistributedTask<T> task) {
        String lockToken = acquireWithRetry(lockKey, timeout);

        if (lockToken == null) {
            log.warn("Gave up on lock {} after {} attempts", lockKey, acquireAttempts);
            throw new MarketplaceException(ErrorKind.UNAVAILABLE, "Unable to acquire lock: " + lockKey);
        }

        try {
            return task.execute();
        } finally {
            releaseLock(lockKey, lockToken);
        }
    }

    private String acquireWithRetry(String lockKey, Duration timeout) {
        for (int attempt = 1; attempt <= acquireAttempts; attempt++) {
            String lockToken = acquireLock(lockKey, timeout);
            if (lockToken != null) {
                return lockToken;
            }
            if (attempt < acquireAttempts) {
                pause(lockKey, retryBackoffMillis * attempt);
            }
        }
        return null;
    }

    private void pause(String lockKey, long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MarketplaceException(ErrorKind.UNAVAILABLE, "Interrupted while waiting for lock: " + lockKey);
        }
    }
}
