package com.work.escrow.core.lock;

import java.time.Duration;

/**
 * 提供 per-item 的互斥锁能力。默认实现使用内存 ConcurrentHashMap，
 * 多节点部署时替换为 Redis 实现。
 */
public interface ItemLockManager {

    /**
     * 尝试获取 item 维度的锁。
     *
     * @param itemId    item 唯一标识
     * @param lockOwner 当前线程/节点的标识
     * @param ttl       锁超时时间
     * @return true 表示加锁成功
     */
    boolean tryLock(String itemId, String lockOwner, Duration ttl);

    /**
     * 释放锁（若锁已超时/转移，实现需要自行判断）。
     */
    void unlock(String itemId, String lockOwner);
}
