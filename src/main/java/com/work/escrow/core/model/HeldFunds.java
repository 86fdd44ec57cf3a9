package com.work.escrow.core.model;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

import static com.work.escrow.core.support.ValidationUtils.requireNonEmpty;
import static com.work.escrow.core.support.ValidationUtils.requireNonNull;
import static com.work.escrow.core.support.ValidationUtils.requirePositive;

/**
 * 被协议托管的资金：既不属于买家也不属于卖家，只能被 release 或 forward 一次。
 */
public final class HeldFunds {

    private final UUID holdId;
    private final String payer;
    private final BigInteger amount;
    private final Instant heldAt;

    public HeldFunds(UUID holdId, String payer, BigInteger amount, Instant heldAt) {
        this.holdId = requireNonNull(holdId, "holdId");
        this.payer = requireNonEmpty(payer, "payer");
        this.amount = requirePositive(amount, "amount");
        this.heldAt = requireNonNull(heldAt, "heldAt");
    }

    public UUID getHoldId() {
        return holdId;
    }

    public String getPayer() {
        return payer;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public Instant getHeldAt() {
        return heldAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return holdId.equals(((HeldFunds) o).holdId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(holdId);
    }

    @Override
    public String toString() {
        return "HeldFunds{" +
                "holdId=" + holdId +
                ", payer='" + payer + '\'' +
                ", amount=" + amount +
                ", heldAt=" + heldAt +
                '}';
    }
}
