package com.work.escrow.core.exception;

public class DuplicateSlotException extends EscrowException {

    public DuplicateSlotException(String itemId) {
        super("托管槽已存在: " + itemId);
    }

    @Override
    public boolean isInvariantViolation() {
        return true;
    }
}
