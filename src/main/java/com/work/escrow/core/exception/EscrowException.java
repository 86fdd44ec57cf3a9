package com.work.escrow.core.exception;

/**
 * 托管协议的统一异常类型，便于业务侧捕获或转换为 RPC / HTTP 错误码。
 */
public class EscrowException extends RuntimeException {

    public EscrowException(String message) {
        super(message);
    }

    public EscrowException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 标识该异常是否可通过稍后重试解决（例如 item 正被其他买家预留）。
     * 默认不可重试。
     */
    public boolean isRetryable() {
        return false;
    }

    /**
     * 标识该异常是否意味着内部一致性被破坏（正确的上架纪律下不应出现）。
     * 调用方应将其视为致命错误并告警。
     */
    public boolean isInvariantViolation() {
        return false;
    }
}
