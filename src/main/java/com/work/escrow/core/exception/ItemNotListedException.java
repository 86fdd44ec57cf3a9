package com.work.escrow.core.exception;

public class ItemNotListedException extends EscrowException {

    public ItemNotListedException(String itemId) {
        super("item 未上架: " + itemId);
    }
}
