package com.work.escrow.core.ledger;

import com.work.escrow.core.model.HeldFunds;
import com.work.escrow.core.model.Payment;

import java.math.BigInteger;

/**
 * 同质化资金的原子转移原语（外部协作方）。
 */
public interface PaymentTransfer {

    /**
     * 从 payer 账户扣出 amount 并交由协议托管。余额不足时抛出
     * {@link com.work.escrow.core.exception.InsufficientFundsException}，不产生任何扣款。
     */
    HeldFunds escrow(String payer, BigInteger amount);

    /**
     * 把托管资金全额释放给 recipient。同一笔托管只能被处置一次。
     */
    void release(HeldFunds heldFunds, String recipient);

    /**
     * 把托管资金转为在途付款，用于结算。同一笔托管只能被处置一次。
     */
    Payment forward(HeldFunds heldFunds);

    /**
     * 把在途付款入账给 recipient。
     */
    void deposit(Payment payment, String recipient);

    BigInteger balanceOf(String account);
}
