package com.work.escrow.core.execution;

import java.util.Objects;
import java.util.concurrent.Callable;

import static com.work.escrow.core.support.ValidationUtils.requireNonEmpty;
import static com.work.escrow.core.support.ValidationUtils.requireNonNull;

/**
 * basic 模式：不做节点内的 item 串行化，直接在当前线程执行，互斥完全交给 item 锁。
 */
public class DirectItemExecutor implements ItemExecutor {

    @Override
    public <T> T execute(String itemId, Callable<T> work) {
        requireNonEmpty(itemId, "itemId");
        requireNonNull(work, "work");
        try {
            return work.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException(Objects.requireNonNullElse(e.getMessage(), "direct execute failed"), e);
        }
    }
}
