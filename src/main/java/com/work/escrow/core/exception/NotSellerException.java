package com.work.escrow.core.exception;

/**
 * 非卖家调用了仅限卖家的操作（响应挑战、下架、取回）。
 */
public class NotSellerException extends EscrowException {

    public NotSellerException(String itemId, String caller) {
        super("调用方不是该 item 的卖家: item=" + itemId + ", caller=" + caller);
    }
}
