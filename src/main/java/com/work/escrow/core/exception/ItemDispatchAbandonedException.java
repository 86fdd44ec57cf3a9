package com.work.escrow.core.exception;

/**
 * 调用方在操作开始前放弃等待（排队超时或线程被中断），排队中的操作已被撤下，
 * 协议状态没有任何变化。调用方可稍后重试。
 */
public class ItemDispatchAbandonedException extends EscrowException {

    public ItemDispatchAbandonedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
