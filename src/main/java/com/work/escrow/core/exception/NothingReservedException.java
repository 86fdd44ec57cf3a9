package com.work.escrow.core.exception;

/**
 * 托管槽为空时尝试取出预留。防止重复结算/重复撤回。
 */
public class NothingReservedException extends EscrowException {

    public NothingReservedException(String itemId) {
        super("item 当前没有待处理的预留: " + itemId);
    }

    @Override
    public boolean isInvariantViolation() {
        return true;
    }
}
