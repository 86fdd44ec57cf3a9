package com.work.escrow.core.lock;

import com.work.escrow.core.config.EscrowConfig;
import com.work.escrow.core.exception.ItemLockContentionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.net.InetAddress;
import java.util.UUID;

import static com.work.escrow.core.support.ValidationUtils.requireNonEmpty;
import static com.work.escrow.core.support.ValidationUtils.requireNonNull;

/**
 * item 维度的互斥协调器，集中管理锁的获取/释放与事务联动。
 * 每个协议操作都在这里形成一个临界区。
 */
public class ItemLockCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ItemLockCoordinator.class);

    private final ItemLockManager lockManager;
    private final EscrowConfig config;

    public ItemLockCoordinator(ItemLockManager lockManager, EscrowConfig config) {
        this.lockManager = requireNonNull(lockManager, "lockManager");
        this.config = requireNonNull(config, "config");
    }

    @FunctionalInterface
    public interface LockCallback<T> {
        T doInLock(String lockOwner);
    }

    public <T> T executeWithLock(String itemId, LockCallback<T> action) {
        requireNonEmpty(itemId, "itemId");
        requireNonNull(action, "action");

        final String lockOwner = buildLockOwner();
        boolean locked = false;
        boolean releaseByTxCallback = false;
        try {
            locked = acquire(itemId, lockOwner);
            releaseByTxCallback = registerReleaseCallback(itemId, lockOwner);
            return action.doInLock(lockOwner);
        } finally {
            if (locked && !releaseByTxCallback) {
                releaseSafely(itemId, lockOwner);
            }
        }
    }

    private boolean acquire(String itemId, String owner) {
        if (lockManager.tryLock(itemId, owner, config.getLockTtl())) {
            return true;
        }
        throw new ItemLockContentionException("item lock contention: " + itemId);
    }

    /**
     * 若处于事务中，则在 commit/rollback 后释放锁；否则交由调用方 finally 释放。
     */
    private boolean registerReleaseCallback(String itemId, String owner) {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            return false;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                releaseSafely(itemId, owner);
            }
        });
        return true;
    }

    /**
     * 释放锁失败只记日志，避免在 finally 或事务钩子中抛出新的错误掩盖业务异常。
     */
    private void releaseSafely(String itemId, String owner) {
        try {
            lockManager.unlock(itemId, owner);
        } catch (Exception e) {
            log.warn("[escrow] release item lock failed: item={}, owner={}", itemId, owner, e);
        }
    }

    /**
     * 生成“机器名 + 线程 ID + UUID”的锁持有者标识，便于排查日志。
     */
    private String buildLockOwner() {
        try {
            String host = InetAddress.getLocalHost().getHostName();
            return host + "-" + Thread.currentThread().getId() + "-" + UUID.randomUUID();
        } catch (Exception ex) {
            return "unknown-" + Thread.currentThread().getId() + "-" + UUID.randomUUID();
        }
    }
}
