package com.work.escrow.core.exception;

/**
 * 非预留买家尝试撤回预留。
 */
public class NotBuyerException extends EscrowException {

    public NotBuyerException(String itemId, String caller) {
        super("调用方不是该预留的买家: item=" + itemId + ", caller=" + caller);
    }
}
