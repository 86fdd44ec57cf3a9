package com.work.escrow.core.model;

import java.math.BigInteger;
import java.util.Objects;

import static com.work.escrow.core.support.ValidationUtils.requireNonEmpty;
import static com.work.escrow.core.support.ValidationUtils.requirePositive;

/**
 * 在途付款：托管资金转发（forward）给 ledger 的购买操作时使用，金额不可拆分。
 */
public final class Payment {

    private final String payer;
    private final BigInteger amount;

    public Payment(String payer, BigInteger amount) {
        this.payer = requireNonEmpty(payer, "payer");
        this.amount = requirePositive(amount, "amount");
    }

    public String getPayer() {
        return payer;
    }

    public BigInteger getAmount() {
        return amount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payment payment = (Payment) o;
        return payer.equals(payment.payer) && amount.equals(payment.amount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(payer, amount);
    }

    @Override
    public String toString() {
        return "Payment{payer='" + payer + "', amount=" + amount + '}';
    }
}
