package com.work.escrow.core.execution;

import com.work.escrow.core.exception.ItemDispatchAbandonedException;
import com.work.escrow.core.exception.ItemDispatchRejectedException;
import com.work.escrow.core.exception.ItemOutcomeUnknownException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class WorkerQueueItemExecutorTest {

    @Test
    public void same_item_always_routes_to_same_worker() {
        try (WorkerQueueItemExecutor executor = new WorkerQueueItemExecutor(8, 16, Duration.ofSeconds(2), "t-")) {
            String first = executor.execute("item-1", () -> Thread.currentThread().getName());
            for (int i = 0; i < 20; i++) {
                assertEquals(first, executor.execute("item-1", () -> Thread.currentThread().getName()));
            }
        }
    }

    @Test
    public void hash_is_stable_and_non_negative() {
        assertEquals(WorkerQueueItemExecutor.positiveHash("item-1"), WorkerQueueItemExecutor.positiveHash("item-1"));
        for (int i = 0; i < 1000; i++) {
            assertTrue(WorkerQueueItemExecutor.positiveHash("item-" + i) >= 0);
        }
    }

    @Test
    public void same_item_work_is_serialized() throws Exception {
        try (WorkerQueueItemExecutor executor = new WorkerQueueItemExecutor(4, 256, Duration.ofSeconds(5), "t-")) {
            List<Integer> order = Collections.synchronizedList(new ArrayList<>());
            List<Thread> callers = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                final int idx = i;
                Thread t = new Thread(() -> executor.execute("item-1", () -> {
                    order.add(idx);
                    order.add(-idx - 1);
                }));
                callers.add(t);
                t.start();
            }
            for (Thread t : callers) {
                t.join(TimeUnit.SECONDS.toMillis(5));
            }

            assertEquals(100, order.size());
            for (int i = 0; i < order.size(); i += 2) {
                assertEquals(-order.get(i) - 1, (int) order.get(i + 1));
            }
        }
    }

    @Test
    public void runtime_exception_is_rethrown_unwrapped() {
        try (WorkerQueueItemExecutor executor = new WorkerQueueItemExecutor(1, 4, Duration.ofSeconds(2), "t-")) {
            IllegalStateException boom = new IllegalStateException("boom");
            Callable<Object> failing = () -> {
                throw boom;
            };
            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> executor.execute("item-1", failing));
            assertSame(boom, e);
        }
    }

    /**
     * 在后台线程占住 item-1 所在的 lane，直到 release 被放行。
     */
    private static Thread occupyLane(WorkerQueueItemExecutor executor, CountDownLatch release,
                                     AtomicReference<RuntimeException> callerError) throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        Thread t = new Thread(() -> {
            try {
                executor.execute("item-1", () -> {
                    started.countDown();
                    release.await();
                    return null;
                });
            } catch (RuntimeException e) {
                callerError.set(e);
            }
        });
        t.start();
        assertTrue(started.await(2, TimeUnit.SECONDS));
        return t;
    }

    @Test
    public void queued_work_dropped_on_timeout_never_runs() throws Exception {
        try (WorkerQueueItemExecutor executor = new WorkerQueueItemExecutor(1, 4, Duration.ofMillis(200), "t-")) {
            CountDownLatch release = new CountDownLatch(1);
            AtomicReference<RuntimeException> runningCallerError = new AtomicReference<>();
            Thread running = occupyLane(executor, release, runningCallerError);

            AtomicBoolean queuedRan = new AtomicBoolean();
            assertThrows(ItemDispatchAbandonedException.class, () -> executor.execute("item-1", () -> {
                queuedRan.set(true);
                return null;
            }));

            // 已开始的操作不会被打断，调用方只知道结果未知
            running.join(2000);
            assertTrue(runningCallerError.get() instanceof ItemOutcomeUnknownException);
            assertFalse(((ItemOutcomeUnknownException) runningCallerError.get()).isRetryable());

            release.countDown();
            // lane 按 FIFO 执行：读取标记时，被撤下的操作若会执行则早已执行
            Callable<Boolean> readFlag = queuedRan::get;
            assertFalse(executor.execute("item-1", readFlag));
        }
    }

    @Test
    public void dropped_work_frees_queue_capacity() throws Exception {
        try (WorkerQueueItemExecutor executor = new WorkerQueueItemExecutor(1, 1, Duration.ofMillis(300), "t-")) {
            CountDownLatch release = new CountDownLatch(1);
            Thread running = occupyLane(executor, release, new AtomicReference<>());

            assertThrows(ItemDispatchAbandonedException.class, () -> executor.execute("item-1", () -> null));

            AtomicReference<Object> result = new AtomicReference<>();
            Thread next = new Thread(() -> result.set(executor.execute("item-1", () -> "next")));
            next.start();
            Thread.sleep(50);
            release.countDown();
            next.join(2000);
            running.join(2000);

            assertEquals("next", result.get());
        }
    }

    @Test
    public void full_queue_is_rejected_without_running() throws Exception {
        try (WorkerQueueItemExecutor executor = new WorkerQueueItemExecutor(1, 1, Duration.ofSeconds(2), "t-")) {
            CountDownLatch release = new CountDownLatch(1);
            Thread running = occupyLane(executor, release, new AtomicReference<>());
            Thread filler = new Thread(() -> executor.execute("item-1", () -> null));
            filler.start();
            Thread.sleep(100);

            AtomicBoolean rejectedRan = new AtomicBoolean();
            ItemDispatchRejectedException e = assertThrows(ItemDispatchRejectedException.class,
                    () -> executor.execute("item-1", () -> {
                        rejectedRan.set(true);
                        return null;
                    }));
            assertTrue(e.isRetryable());

            release.countDown();
            filler.join(2000);
            running.join(2000);
            assertFalse(rejectedRan.get());
        }
    }

    @Test
    public void invalid_settings_are_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new WorkerQueueItemExecutor(0, 1, Duration.ofSeconds(1), "t-"));
        assertThrows(IllegalArgumentException.class,
                () -> new WorkerQueueItemExecutor(1, 0, Duration.ofSeconds(1), "t-"));
        assertThrows(IllegalArgumentException.class,
                () -> new WorkerQueueItemExecutor(1, 1, Duration.ZERO, "t-"));
    }
}
