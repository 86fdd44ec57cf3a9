package com.work.escrow.core.exception;

/**
 * 操作已经开始执行，但调用方在其完成前停止等待：操作会完整执行到底，
 * 只是调用方拿不到结果。重试前应先查询 item 的当前状态，不可直接重放。
 */
public class ItemOutcomeUnknownException extends EscrowException {

    public ItemOutcomeUnknownException(String message, Throwable cause) {
        super(message, cause);
    }
}
