package com.work.escrow.core.support;

import com.work.escrow.core.lock.ItemLockManager;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 使用 ConcurrentHashMap 模拟分布式锁的简单实现，单节点部署时即为默认实现。
 */
public class InMemoryItemLockManager implements ItemLockManager {

    private static class LockInfo {
        String owner;
        Instant expireAt;
    }

    private final Map<String, LockInfo> locks = new ConcurrentHashMap<>();

    @Override
    public boolean tryLock(String itemId, String lockOwner, Duration ttl) {
        LockInfo newLock = new LockInfo();
        newLock.owner = lockOwner;
        newLock.expireAt = Instant.now().plus(ttl);
        final boolean[] acquired = {false};
        locks.compute(itemId, (key, existing) -> {
            Instant now = Instant.now();
            if (existing == null || existing.expireAt.isBefore(now)) {
                acquired[0] = true;
                return newLock;
            }
            if (existing.owner.equals(lockOwner)) {
                existing.expireAt = now.plus(ttl);
                acquired[0] = true;
                return existing;
            }
            acquired[0] = false;
            return existing;
        });
        return acquired[0];
    }

    @Override
    public void unlock(String itemId, String lockOwner) {
        locks.computeIfPresent(itemId, (key, existing) -> {
            if (existing.owner.equals(lockOwner) || existing.expireAt.isBefore(Instant.now())) {
                return null;
            }
            return existing;
        });
    }

    boolean isLocked(String itemId) {
        LockInfo info = locks.get(itemId);
        return info != null && !info.expireAt.isBefore(Instant.now());
    }
}
