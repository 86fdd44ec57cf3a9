package com.work.escrow.core.exception;

/**
 * 验证已通过但 ledger 拒绝结算。此时资金已退回买家，异常仅用于告警。
 */
public class EscrowInvariantViolationException extends EscrowException {

    public EscrowInvariantViolationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isInvariantViolation() {
        return true;
    }
}
