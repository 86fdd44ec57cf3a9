package com.work.escrow.core.exception;

/**
 * 未能获取 item 维度的互斥锁（其他节点/线程正在处理同一 item），调用方应当重试。
 */
public class ItemLockContentionException extends EscrowException {

    public ItemLockContentionException(String message) {
        super(message);
    }

    public ItemLockContentionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
