package com.work.escrow.core.execution;

import java.util.concurrent.Callable;

import static com.work.escrow.core.support.ValidationUtils.requireNonEmpty;
import static com.work.escrow.core.support.ValidationUtils.requireNonNull;

/**
 * 统一的“按 item 执行”入口。
 *
 * 设计目标：
 * - 同一 item 的协议操作被串行化，每次操作完整执行后才开始下一次
 * - 不同 item 的操作可并行
 * - basic / worker-queue 两种模式对调用方保持一致
 */
public interface ItemExecutor {

    <T> T execute(String itemId, Callable<T> work);

    default void execute(String itemId, Runnable work) {
        requireNonEmpty(itemId, "itemId");
        requireNonNull(work, "work");
        execute(itemId, () -> {
            work.run();
            return null;
        });
    }
}
