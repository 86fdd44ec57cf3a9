package com.work.escrow.core.exception;

/**
 * item 的托管槽已被其他买家占用。调用方应在当前预留结束后重试。
 */
public class ItemReservedException extends EscrowException {

    private final String itemId;

    public ItemReservedException(String itemId) {
        super("item 已被预留: " + itemId);
        this.itemId = itemId;
    }

    public String getItemId() {
        return itemId;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
