package com.work.escrow.core.support;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class InMemoryItemLockManagerTest {

    @Test
    public void lock_is_exclusive_and_reentrant_for_owner() {
        InMemoryItemLockManager m = new InMemoryItemLockManager();
        assertTrue(m.tryLock("item-1", "o1", Duration.ofSeconds(10)));
        assertTrue(m.tryLock("item-1", "o1", Duration.ofSeconds(10)));
        assertFalse(m.tryLock("item-1", "o2", Duration.ofSeconds(10)));
        assertTrue(m.tryLock("item-2", "o2", Duration.ofSeconds(10)));
    }

    @Test
    public void unlock_by_other_owner_is_ignored() {
        InMemoryItemLockManager m = new InMemoryItemLockManager();
        m.tryLock("item-1", "o1", Duration.ofSeconds(10));

        m.unlock("item-1", "o2");
        assertTrue(m.isLocked("item-1"));

        m.unlock("item-1", "o1");
        assertFalse(m.isLocked("item-1"));
    }

    @Test
    public void expired_lock_can_be_taken_over() throws InterruptedException {
        InMemoryItemLockManager m = new InMemoryItemLockManager();
        m.tryLock("item-1", "o1", Duration.ofMillis(20));
        Thread.sleep(50);

        assertFalse(m.isLocked("item-1"));
        assertTrue(m.tryLock("item-1", "o2", Duration.ofSeconds(10)));
    }
}
