package com.work.escrow.core.lock.impl;

import com.work.escrow.core.exception.ItemLockContentionException;
import com.work.escrow.core.lock.ItemLockManager;
import com.work.escrow.core.support.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.Collections;

import static com.work.escrow.core.support.ValidationUtils.requireNonEmpty;
import static com.work.escrow.core.support.ValidationUtils.requirePositive;

/**
 * 基于 Redis 的分布式 item 锁
 *
 * 特性：
 * 1. SET NX + 过期时间原子加锁，锁超时自动释放，避免死锁
 * 2. 释放锁使用 Lua 脚本校验 owner，防止误释放其他实例的锁
 */
public class RedisItemLockManager implements ItemLockManager {

    private static final String LOCK_KEY_PREFIX = "escrow:lock:";
    private static final Logger LOGGER = LoggerFactory.getLogger(RedisItemLockManager.class);

    // 只有锁的 owner 匹配时才删除
    private static final String UNLOCK_SCRIPT =
            "if redis.call('get', KEYS[1]) == ARGV[1] then " +
            "    return redis.call('del', KEYS[1]) " +
            "else " +
            "    return 0 " +
            "end";

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<Long> unlockScript;

    public RedisItemLockManager(StringRedisTemplate redisTemplate) {
        this.redisTemplate = ValidationUtils.requireNonNull(redisTemplate, "redisTemplate");
        this.unlockScript = new DefaultRedisScript<>();
        this.unlockScript.setScriptText(UNLOCK_SCRIPT);
        this.unlockScript.setResultType(Long.class);
    }

    /**
     * @throws ItemLockContentionException Redis 访问异常时抛出，调用方可重试
     */
    @Override
    public boolean tryLock(String itemId, String lockOwner, Duration ttl) {
        requireNonEmpty(itemId, "itemId");
        requireNonEmpty(lockOwner, "lockOwner");
        requirePositive(ttl, "ttl");

        String key = LOCK_KEY_PREFIX + itemId;
        try {
            Boolean result = redisTemplate.opsForValue().setIfAbsent(key, lockOwner, ttl);
            return Boolean.TRUE.equals(result);
        } catch (Exception e) {
            throw new ItemLockContentionException("Redis 加锁异常: " + itemId, e);
        }
    }

    @Override
    public void unlock(String itemId, String lockOwner) {
        requireNonEmpty(itemId, "itemId");
        requireNonEmpty(lockOwner, "lockOwner");

        String key = LOCK_KEY_PREFIX + itemId;
        try {
            Long result = redisTemplate.execute(unlockScript, Collections.singletonList(key), lockOwner);
            if (result == null || result == 0) {
                // 锁不存在或 owner 不匹配，一般意味着已过期
                LOGGER.debug("[escrow] unlock noop, key may be expired or owned by others, item={}, owner={}",
                        itemId, lockOwner);
            }
        } catch (Exception e) {
            LOGGER.warn("[escrow] Redis 释放锁异常: item={}, owner={}", itemId, lockOwner, e);
        }
    }
}
