package com.work.escrow.core.exception;

/**
 * item 所在的执行队列已满，操作未入队，协议状态没有任何变化。调用方可稍后重试。
 */
public class ItemDispatchRejectedException extends EscrowException {

    public ItemDispatchRejectedException(String itemId, Throwable cause) {
        super("item 执行队列已满，操作未执行: " + itemId, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
