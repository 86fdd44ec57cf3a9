package com.work.escrow.core.execution;

import com.work.escrow.core.exception.ItemDispatchAbandonedException;
import com.work.escrow.core.exception.ItemDispatchRejectedException;
import com.work.escrow.core.exception.ItemOutcomeUnknownException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.work.escrow.core.support.ValidationUtils.requireNonEmpty;
import static com.work.escrow.core.support.ValidationUtils.requireNonNull;

/**
 * worker-queue 模式：hash(itemId) 选定一条单线程 lane，同一 item 的协议操作在 lane 上依次执行。
 *
 * <p>一次协议操作要么完整生效、要么完全不生效，因此调用方停止等待时按操作是否已开始区分：</p>
 * <ul>
 *   <li>尚在排队：从 lane 撤下，永远不会执行，抛 {@link ItemDispatchAbandonedException}</li>
 *   <li>已开始：不打断，让它执行完，抛 {@link ItemOutcomeUnknownException}</li>
 *   <li>lane 队列已满：不入队，抛 {@link ItemDispatchRejectedException}</li>
 * </ul>
 */
public class WorkerQueueItemExecutor implements ItemExecutor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerQueueItemExecutor.class);

    private final ThreadPoolExecutor[] lanes;
    private final Duration dispatchTimeout;

    public WorkerQueueItemExecutor(int laneCount,
                                   int queueCapacity,
                                   Duration dispatchTimeout,
                                   String threadNamePrefix) {
        if (laneCount <= 0) {
            throw new IllegalArgumentException("laneCount must be > 0");
        }
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be > 0");
        }
        this.dispatchTimeout = requireNonNull(dispatchTimeout, "dispatchTimeout");
        if (dispatchTimeout.isNegative() || dispatchTimeout.isZero()) {
            throw new IllegalArgumentException("dispatchTimeout must be > 0");
        }
        String prefix = threadNamePrefix == null || threadNamePrefix.trim().isEmpty()
                ? "escrow-worker-"
                : threadNamePrefix.trim();

        this.lanes = new ThreadPoolExecutor[laneCount];
        for (int i = 0; i < laneCount; i++) {
            String threadName = prefix + i;
            // AbortPolicy：队列满时 execute 直接抛 RejectedExecutionException
            ThreadPoolExecutor lane = new ThreadPoolExecutor(
                    1, 1,
                    0L, TimeUnit.MILLISECONDS,
                    new ArrayBlockingQueue<>(queueCapacity),
                    r -> {
                        Thread t = new Thread(r, threadName);
                        t.setDaemon(true);
                        return t;
                    },
                    new ThreadPoolExecutor.AbortPolicy());
            lane.prestartAllCoreThreads();
            lanes[i] = lane;
        }
    }

    @Override
    public <T> T execute(String itemId, Callable<T> work) {
        requireNonEmpty(itemId, "itemId");
        requireNonNull(work, "work");
        ThreadPoolExecutor lane = laneFor(itemId);
        FutureTask<T> task = new FutureTask<>(work);
        try {
            lane.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("[escrow] lane queue full, operation rejected item={} queued={}", itemId, lane.getQueue().size());
            throw new ItemDispatchRejectedException(itemId, e);
        }

        try {
            return unwrap(task, dispatchTimeout.toMillis());
        } catch (TimeoutException e) {
            return giveUp(itemId, lane, task, "等待超时 timeout=" + dispatchTimeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return giveUp(itemId, lane, task, "调用线程被中断", e);
        }
    }

    /**
     * 调用方停止等待：cancel(false) 只会成功撤下尚未开始的任务，已开始的任务不受影响。
     */
    private <T> T giveUp(String itemId, ThreadPoolExecutor lane, FutureTask<T> task, String reason, Exception cause) {
        if (task.cancel(false)) {
            // 释放队列容量，撤下的任务不会再被执行
            lane.remove(task);
            log.warn("[escrow] operation dropped before start item={} reason={}", itemId, reason);
            throw new ItemDispatchAbandonedException("item 操作未开始即被撤下(" + reason + "): " + itemId, cause);
        }
        if (task.isDone()) {
            // 超时与撤下之间恰好执行完：结果已确定，照常返回
            try {
                return unwrap(task, 0L);
            } catch (TimeoutException | InterruptedException unexpected) {
                throw new IllegalStateException("completed task did not yield a result, item=" + itemId, unexpected);
            }
        }
        log.warn("[escrow] operation still running after caller gave up, outcome unknown item={} reason={}",
                itemId, reason);
        throw new ItemOutcomeUnknownException("item 操作已开始但结果未知(" + reason + ")，请先查询 item 状态: " + itemId,
                cause);
    }

    private static <T> T unwrap(FutureTask<T> task, long timeoutMillis)
            throws TimeoutException, InterruptedException {
        try {
            return task.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (CancellationException e) {
            throw new IllegalStateException("lane task cancelled unexpectedly", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            String msg = cause != null && cause.getMessage() != null ? cause.getMessage() : "lane execution failed";
            throw new RuntimeException(msg, cause);
        }
    }

    private ThreadPoolExecutor laneFor(String itemId) {
        return lanes[positiveHash(itemId) % lanes.length];
    }

    // FNV-1a 32-bit
    static int positiveHash(String itemId) {
        byte[] data = itemId.getBytes(StandardCharsets.UTF_8);
        int hash = 0x811c9dc5;
        for (byte b : data) {
            hash ^= (b & 0xff);
            hash *= 0x01000193;
        }
        return hash & 0x7fffffff;
    }

    @Override
    public void close() {
        for (ThreadPoolExecutor lane : lanes) {
            lane.shutdown();
        }
    }
}
