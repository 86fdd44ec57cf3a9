package com.work.escrow.core.model;

import java.math.BigInteger;
import java.time.Instant;

/**
 * 托管槽的只读视图，供查询接口与巡检任务使用；不暴露挑战与公钥原文。
 */
public final class EscrowSlotView {

    private final String itemId;
    private final SlotState state;
    private final String buyerAddress;
    private final BigInteger escrowedAmount;
    private final Instant reservedAt;
    private final boolean exclusive;

    private EscrowSlotView(String itemId, SlotState state, String buyerAddress,
                           BigInteger escrowedAmount, Instant reservedAt, boolean exclusive) {
        this.itemId = itemId;
        this.state = state;
        this.buyerAddress = buyerAddress;
        this.escrowedAmount = escrowedAmount;
        this.reservedAt = reservedAt;
        this.exclusive = exclusive;
    }

    public static EscrowSlotView available(String itemId) {
        return new EscrowSlotView(itemId, SlotState.AVAILABLE, null, null, null, false);
    }

    public static EscrowSlotView reserved(PurchaseIntent intent) {
        return new EscrowSlotView(intent.getItemId(), SlotState.RESERVED, intent.getBuyerAddress(),
                intent.getEscrowedFunds().getAmount(), intent.getReservedAt(),
                intent.getExclusiveCapability().isPresent());
    }

    public String getItemId() {
        return itemId;
    }

    public SlotState getState() {
        return state;
    }

    public String getBuyerAddress() {
        return buyerAddress;
    }

    public BigInteger getEscrowedAmount() {
        return escrowedAmount;
    }

    public Instant getReservedAt() {
        return reservedAt;
    }

    public boolean isExclusive() {
        return exclusive;
    }
}
