package com.tixgo.catalog.service;

import com.tixgo.common.exception.ErrorKind;
import com.tixgo.common.exception.MarketplaceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisDistributedLockServiceTest {

    private static final String SLOTS_KEY = "tixgo:lock:advertise_slots";
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisDistributedLockService lockService;

    @BeforeEach
    void setUp() {
        lockService = new RedisDistributedLockService(redisTemplate, 3, 0);
    }

    // ─── acquireLock ─────────────────────────────────────────────────────

    @Test
    void acquireLock_Success_ReturnsToken() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(eq(SLOTS_KEY), anyString(), eq(TIMEOUT))).thenReturn(true);

        String token = lockService.acquireLock(DistributedLockService.advertiseSlotsLock(), TIMEOUT);

        assertNotNull(token);
        verify(valueOperations).setIfAbsent(eq(SLOTS_KEY), eq(token), eq(TIMEOUT));
    }

    @Test
    void acquireLock_HeldElsewhere_ReturnsNull() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(eq(SLOTS_KEY), anyString(), any(Duration.class))).thenReturn(false);

        assertNull(lockService.acquireLock("advertise_slots", TIMEOUT));
    }

    @Test
    void acquireLock_NullReply_ReturnsNull() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(null);

        assertNull(lockService.acquireLock("advertise_slots", TIMEOUT));
    }

    @Test
    void acquireLock_RedisDown_ReturnsNull() {
        when(redisTemplate.opsForValue()).thenThrow(new RedisConnectionFailureException("Redis down"));

        assertNull(lockService.acquireLock("advertise_slots", TIMEOUT));
    }

    // ─── releaseLock ─────────────────────────────────────────────────────

    @Test
    void releaseLock_Owner_ReturnsTrue() {
        when(redisTemplate.execute(any(DefaultRedisScript.class), eq(Collections.singletonList(SLOTS_KEY)), eq("token-123")))
            .thenReturn(1L);

        assertTrue(lockService.releaseLock("advertise_slots", "token-123"));
    }

    @Test
    void releaseLock_ExpiredOrNotOwner_ReturnsFalse() {
        when(redisTemplate.execute(any(DefaultRedisScript.class), anyList(), anyString())).thenReturn(0L);

        assertFalse(lockService.releaseLock("advertise_slots", "stale-token"));
    }

    @Test
    void releaseLock_RedisError_ReturnsFalse() {
        when(redisTemplate.execute(any(DefaultRedisScript.class), anyList(), anyString()))
            .thenThrow(new RedisConnectionFailureException("Redis error"));

        assertFalse(lockService.releaseLock("advertise_slots", "token-123"));
    }

    // ─── executeWithLock ─────────────────────────────────────────────────

    @Test
    void executeWithLock_RunsTaskAndReleases() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(eq(SLOTS_KEY), anyString(), eq(TIMEOUT))).thenReturn(true);
        when(redisTemplate.execute(any(DefaultRedisScript.class), anyList(), anyString())).thenReturn(1L);

        Integer result = lockService.executeWithLock("advertise_slots", TIMEOUT, () -> 1);

        assertEquals(1, result);
        verify(redisTemplate).execute(any(DefaultRedisScript.class), eq(Collections.singletonList(SLOTS_KEY)), anyString());
    }

    @Test
    void executeWithLock_LockBusy_UnavailableAndTaskNotRun() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(false);
        AtomicBoolean ran = new AtomicBoolean(false);

        MarketplaceException e = assertThrows(MarketplaceException.class,
            () -> lockService.executeWithLock("advertise_slots", TIMEOUT, () -> {
                ran.set(true);
                return 1;
            }));

        assertEquals(ErrorKind.UNAVAILABLE, e.getKind());
        assertFalse(ran.get());
        verify(valueOperations, times(3)).setIfAbsent(anyString(), anyString(), any(Duration.class));
        verify(redisTemplate, never()).execute(any(DefaultRedisScript.class), anyList(), anyString());
    }

    @Test
    void executeWithLock_BusyThenFree_RunsTask() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(eq(SLOTS_KEY), anyString(), eq(TIMEOUT))).thenReturn(false, false, true);
        when(redisTemplate.execute(any(DefaultRedisScript.class), anyList(), anyString())).thenReturn(1L);

        Integer result = lockService.executeWithLock("advertise_slots", TIMEOUT, () -> 7);

        assertEquals(7, result);
        verify(valueOperations, times(3)).setIfAbsent(eq(SLOTS_KEY), anyString(), eq(TIMEOUT));
    }

    @Test
    void executeWithLock_TaskThrows_StillReleasesLock() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(true);
        when(redisTemplate.execute(any(DefaultRedisScript.class), anyList(), anyString())).thenReturn(1L);

        assertThrows(IllegalStateException.class,
            () -> lockService.executeWithLock("advertise_slots", TIMEOUT, () -> {
                throw new IllegalStateException("Task failed");
            }));

        verify(redisTemplate).execute(any(DefaultRedisScript.class), anyList(), anyString());
    }

    @Test
    void advertiseSlotsLock_IsSingleGlobalKey() {
        assertEquals("advertise_slots", DistributedLockService.advertiseSlotsLock());
    }
}
