package com.work.escrow.core.exception;

/**
 * 挑战必须一次性使用；在重放窗口内再次出现的挑战会被拒绝。
 */
public class ChallengeReusedException extends EscrowException {

    public ChallengeReusedException(String itemId) {
        super("challenge 已被使用过: item=" + itemId);
    }
}
