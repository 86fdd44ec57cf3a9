package com.work.escrow.core.exception;

/**
 * 购买请求本身不合法：金额与挂牌价不符、独占购买凭证无效、挑战格式不合规等。
 * 抛出时不会产生任何状态变更。
 */
public class InvalidPurchaseException extends EscrowException {

    public InvalidPurchaseException(String message) {
        super(message);
    }
}
