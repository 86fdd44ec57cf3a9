package com.work.escrow.core;

import com.work.escrow.core.cache.ChallengeReplayGuard;
import com.work.escrow.core.config.EscrowConfig;
import com.work.escrow.core.exception.ItemLockContentionException;
import com.work.escrow.core.exception.ItemReservedException;
import com.work.escrow.core.execution.DirectItemExecutor;
import com.work.escrow.core.execution.ItemExecutor;
import com.work.escrow.core.execution.WorkerQueueItemExecutor;
import com.work.escrow.core.lock.ItemLockCoordinator;
import com.work.escrow.core.lock.ItemLockManager;
import com.work.escrow.core.metrics.NoopEscrowMetrics;
import com.work.escrow.core.model.ResponseOutcome;
import com.work.escrow.core.model.SlotState;
import com.work.escrow.core.service.PurchaseIntentLifecycle;
import com.work.escrow.core.support.InMemoryEscrowSlotStore;
import com.work.escrow.core.support.InMemoryItemLockManager;
import com.work.escrow.core.verify.Secp256k1SignatureVerifier;
import com.work.escrow.demo.event.InMemoryEscrowEventStore;
import com.work.escrow.demo.item.CollectibleItem;
import com.work.escrow.demo.ledger.InMemoryCapabilityCustody;
import com.work.escrow.demo.ledger.InMemoryListingLedger;
import com.work.escrow.demo.ledger.InMemoryPaymentTransfer;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.work.escrow.testsupport.SigningKeys.ALICE;
import static com.work.escrow.testsupport.SigningKeys.challenge;
import static com.work.escrow.testsupport.SigningKeys.publicKey;
import static com.work.escrow.testsupport.SigningKeys.sign;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class EscrowComponentTest {

    private static final BigInteger PRICE = BigInteger.valueOf(100);

    private final InMemoryPaymentTransfer payments = new InMemoryPaymentTransfer();

    private EscrowComponent<CollectibleItem> component(ItemExecutor executor,
                                                       ItemLockManager lockManager) {
        EscrowConfig config = EscrowConfig.defaultConfig();
        PurchaseIntentLifecycle<CollectibleItem> lifecycle = new PurchaseIntentLifecycle<>(
                new InMemoryEscrowSlotStore(),
                new InMemoryListingLedger<>(payments),
                payments,
                new InMemoryCapabilityCustody(),
                new Secp256k1SignatureVerifier(false),
                new InMemoryEscrowEventStore(),
                new ChallengeReplayGuard(config),
                config,
                new NoopEscrowMetrics());
        return new EscrowComponent<>(lifecycle, executor, new ItemLockCoordinator(lockManager, config));
    }

    @Test
    public void full_round_trip_through_executor_and_lock() {
        EscrowComponent<CollectibleItem> escrow = component(new DirectItemExecutor(), new InMemoryItemLockManager());
        payments.credit("buyer-1", PRICE);
        escrow.list("seller-1", new CollectibleItem("item-1", "card", "seller-1"), PRICE);
        byte[] c = challenge("round-trip");

        escrow.purchase("item-1", "buyer-1", c, publicKey(ALICE), PRICE);
        assertEquals(SlotState.RESERVED, escrow.slotView("item-1").get().getState());

        ResponseOutcome<CollectibleItem> outcome = escrow.submitResponse("item-1", "seller-1", sign(ALICE, c));

        assertTrue(outcome.isSettled());
        assertEquals(PRICE, payments.balanceOf("seller-1"));
        assertTrue(escrow.snapshot().isEmpty());
    }

    @Test
    public void concurrent_purchases_admit_exactly_one_buyer() throws Exception {
        int buyers = 16;
        try (WorkerQueueItemExecutor executor = new WorkerQueueItemExecutor(4, 64, Duration.ofSeconds(5), "test-")) {
            EscrowComponent<CollectibleItem> escrow = component(executor, new InMemoryItemLockManager());
            escrow.list("seller-1", new CollectibleItem("item-1", "card", "seller-1"), PRICE);
            for (int i = 0; i < buyers; i++) {
                payments.credit("buyer-" + i, PRICE);
            }

            ExecutorService pool = Executors.newFixedThreadPool(buyers);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger reserved = new AtomicInteger();
            AtomicInteger rejected = new AtomicInteger();
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < buyers; i++) {
                final int idx = i;
                futures.add(pool.submit(() -> {
                    start.await();
                    try {
                        escrow.purchase("item-1", "buyer-" + idx, challenge("c" + idx), publicKey(ALICE), PRICE);
                        reserved.incrementAndGet();
                    } catch (ItemReservedException e) {
                        rejected.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
            pool.shutdown();

            assertEquals(1, reserved.get());
            assertEquals(buyers - 1, rejected.get());
            assertEquals(PRICE, payments.totalHeld());
        }
    }

    @Test
    public void lock_contention_fails_before_any_effect() {
        ItemLockManager lockManager = mock(ItemLockManager.class);
        when(lockManager.tryLock(anyString(), anyString(), any())).thenReturn(false);
        EscrowComponent<CollectibleItem> escrow = component(new DirectItemExecutor(), lockManager);

        ItemLockContentionException e = assertThrows(ItemLockContentionException.class,
                () -> escrow.list("seller-1", new CollectibleItem("item-1", "card", "seller-1"), PRICE));

        assertTrue(e.isRetryable());
        assertTrue(escrow.snapshot().isEmpty());
        verify(lockManager, never()).unlock(anyString(), anyString());
    }

    @Test
    public void lock_is_released_after_failed_operation() {
        InMemoryItemLockManager lockManager = new InMemoryItemLockManager();
        EscrowComponent<CollectibleItem> escrow = component(new DirectItemExecutor(), lockManager);

        assertThrows(RuntimeException.class, () -> escrow.withdraw("item-404", "buyer-1"));

        assertTrue(lockManager.tryLock("item-404", "someone-else", Duration.ofSeconds(1)));
    }
}
