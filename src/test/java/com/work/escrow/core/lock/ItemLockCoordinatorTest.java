package com.work.escrow.core.lock;

import com.work.escrow.core.config.EscrowConfig;
import com.work.escrow.core.exception.ItemLockContentionException;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ItemLockCoordinatorTest {

    @Test
    public void releases_lock_after_action() {
        ItemLockManager lockManager = mock(ItemLockManager.class);
        when(lockManager.tryLock(eq("item-1"), anyString(), any())).thenReturn(true);
        ItemLockCoordinator coordinator = new ItemLockCoordinator(lockManager, EscrowConfig.defaultConfig());

        String result = coordinator.executeWithLock("item-1", owner -> "done");

        assertEquals("done", result);
        verify(lockManager, times(1)).unlock(eq("item-1"), anyString());
    }

    @Test
    public void releases_lock_when_action_throws() {
        ItemLockManager lockManager = mock(ItemLockManager.class);
        when(lockManager.tryLock(eq("item-1"), anyString(), any())).thenReturn(true);
        ItemLockCoordinator coordinator = new ItemLockCoordinator(lockManager, EscrowConfig.defaultConfig());

        assertThrows(IllegalStateException.class, () -> coordinator.executeWithLock("item-1", owner -> {
            throw new IllegalStateException("boom");
        }));
        verify(lockManager).unlock(eq("item-1"), anyString());
    }

    @Test
    public void contention_throws_without_running_action() {
        ItemLockManager lockManager = mock(ItemLockManager.class);
        when(lockManager.tryLock(anyString(), anyString(), any())).thenReturn(false);
        ItemLockCoordinator coordinator = new ItemLockCoordinator(lockManager, EscrowConfig.defaultConfig());
        Runnable action = mock(Runnable.class);

        assertThrows(ItemLockContentionException.class, () -> coordinator.executeWithLock("item-1", owner -> {
            action.run();
            return null;
        }));
        verify(action, never()).run();
        verify(lockManager, never()).unlock(anyString(), anyString());
    }

    @Test
    public void unlock_failure_does_not_mask_result() {
        ItemLockManager lockManager = mock(ItemLockManager.class);
        when(lockManager.tryLock(anyString(), anyString(), any())).thenReturn(true);
        doThrow(new RuntimeException("redis down")).when(lockManager).unlock(anyString(), anyString());
        ItemLockCoordinator coordinator = new ItemLockCoordinator(lockManager, EscrowConfig.defaultConfig());

        assertEquals(Integer.valueOf(7), coordinator.executeWithLock("item-1", owner -> 7));
    }

    @Test
    public void inside_transaction_lock_is_released_after_completion() {
        ItemLockManager lockManager = mock(ItemLockManager.class);
        when(lockManager.tryLock(anyString(), anyString(), any())).thenReturn(true);
        ItemLockCoordinator coordinator = new ItemLockCoordinator(lockManager, EscrowConfig.defaultConfig());

        TransactionSynchronizationManager.initSynchronization();
        TransactionSynchronizationManager.setActualTransactionActive(true);
        try {
            coordinator.executeWithLock("item-1", owner -> null);
            verify(lockManager, never()).unlock(anyString(), anyString());

            List<TransactionSynchronization> syncs = TransactionSynchronizationManager.getSynchronizations();
            assertEquals(1, syncs.size());
            syncs.get(0).afterCompletion(TransactionSynchronization.STATUS_COMMITTED);
            verify(lockManager).unlock(eq("item-1"), anyString());
        } finally {
            TransactionSynchronizationManager.setActualTransactionActive(false);
            TransactionSynchronizationManager.clearSynchronization();
        }
    }
}
