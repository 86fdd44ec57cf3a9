package com.work.escrow.demo.ledger;

import com.work.escrow.core.exception.EscrowException;
import com.work.escrow.core.exception.InsufficientFundsException;
import com.work.escrow.core.ledger.PaymentTransfer;
import com.work.escrow.core.model.HeldFunds;
import com.work.escrow.core.model.Payment;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import static com.work.escrow.core.support.ValidationUtils.requireNonEmpty;
import static com.work.escrow.core.support.ValidationUtils.requireNonNull;
import static com.work.escrow.core.support.ValidationUtils.requirePositive;

/**
 * 纯内存的账户余额实现，方便在没有真实支付通道的环境下演示协议行为。
 *
 * <p>托管中的资金记录在 holds 表中，release/forward 都会把记录移除，
 * 因此同一笔托管只能被处置一次。</p>
 */
public class InMemoryPaymentTransfer implements PaymentTransfer {

    private final Map<String, BigInteger> balances = new ConcurrentHashMap<>();
    private final Map<UUID, HeldFunds> holds = new ConcurrentHashMap<>();
    private final Object mutex = new Object();

    /**
     * demo 充值入口。
     */
    public void credit(String account, BigInteger amount) {
        requireNonEmpty(account, "account");
        requirePositive(amount, "amount");
        synchronized (mutex) {
            balances.merge(account, amount, BigInteger::add);
        }
    }

    @Override
    public HeldFunds escrow(String payer, BigInteger amount) {
        requireNonEmpty(payer, "payer");
        requirePositive(amount, "amount");
        synchronized (mutex) {
            BigInteger available = balances.getOrDefault(payer, BigInteger.ZERO);
            if (available.compareTo(amount) < 0) {
                throw new InsufficientFundsException(payer, amount, available);
            }
            balances.put(payer, available.subtract(amount));
            HeldFunds held = new HeldFunds(UUID.randomUUID(), payer, amount, Instant.now());
            holds.put(held.getHoldId(), held);
            return held;
        }
    }

    @Override
    public void release(HeldFunds heldFunds, String recipient) {
        requireNonEmpty(recipient, "recipient");
        synchronized (mutex) {
            HeldFunds held = removeHold(heldFunds);
            balances.merge(recipient, held.getAmount(), BigInteger::add);
        }
    }

    @Override
    public Payment forward(HeldFunds heldFunds) {
        synchronized (mutex) {
            HeldFunds held = removeHold(heldFunds);
            return new Payment(held.getPayer(), held.getAmount());
        }
    }

    @Override
    public void deposit(Payment payment, String recipient) {
        requireNonNull(payment, "payment");
        requireNonEmpty(recipient, "recipient");
        synchronized (mutex) {
            balances.merge(recipient, payment.getAmount(), BigInteger::add);
        }
    }

    @Override
    public BigInteger balanceOf(String account) {
        requireNonEmpty(account, "account");
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    /**
     * 当前仍处于托管中的资金总额。
     */
    public BigInteger totalHeld() {
        synchronized (mutex) {
            return holds.values().stream().map(HeldFunds::getAmount).reduce(BigInteger.ZERO, BigInteger::add);
        }
    }

    private HeldFunds removeHold(HeldFunds heldFunds) {
        requireNonNull(heldFunds, "heldFunds");
        HeldFunds held = holds.remove(heldFunds.getHoldId());
        if (held == null) {
            throw new EscrowException("托管资金不存在或已被处置: " + heldFunds.getHoldId());
        }
        return held;
    }
}
