package com.work.escrow.core.lock.impl;

import com.work.escrow.core.exception.ItemLockContentionException;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class RedisItemLockManagerTest {

    @SuppressWarnings("unchecked")
    private static ValueOperations<String, String> valueOps(StringRedisTemplate template) {
        ValueOperations<String, String> ops = mock(ValueOperations.class);
        when(template.opsForValue()).thenReturn(ops);
        return ops;
    }

    @Test
    public void try_lock_uses_set_if_absent_with_ttl() {
        StringRedisTemplate template = mock(StringRedisTemplate.class);
        ValueOperations<String, String> ops = valueOps(template);
        when(ops.setIfAbsent("escrow:lock:item-1", "o1", Duration.ofSeconds(10))).thenReturn(true);
        when(ops.setIfAbsent("escrow:lock:item-1", "o2", Duration.ofSeconds(10))).thenReturn(false);
        RedisItemLockManager m = new RedisItemLockManager(template);

        assertTrue(m.tryLock("item-1", "o1", Duration.ofSeconds(10)));
        assertFalse(m.tryLock("item-1", "o2", Duration.ofSeconds(10)));
    }

    @Test
    public void redis_failure_on_lock_is_contention() {
        StringRedisTemplate template = mock(StringRedisTemplate.class);
        ValueOperations<String, String> ops = valueOps(template);
        when(ops.setIfAbsent(any(), any(), any(Duration.class))).thenThrow(new RuntimeException("conn refused"));
        RedisItemLockManager m = new RedisItemLockManager(template);

        assertThrows(ItemLockContentionException.class, () -> m.tryLock("item-1", "o1", Duration.ofSeconds(1)));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void unlock_runs_owner_checked_script() {
        StringRedisTemplate template = mock(StringRedisTemplate.class);
        RedisItemLockManager m = new RedisItemLockManager(template);

        m.unlock("item-1", "o1");

        verify(template).execute(any(RedisScript.class), eq(Collections.singletonList("escrow:lock:item-1")), eq("o1"));
    }
}
