package com.work.escrow.core.event;

import java.time.Instant;

import static com.work.escrow.core.support.ValidationUtils.requireNonEmpty;
import static com.work.escrow.core.support.ValidationUtils.requireNonNull;

/**
 * 生命周期事件：只追加、仅供观察，不参与协议正确性判断。
 */
public abstract class EscrowEvent {

    private final String itemId;
    private final String buyerAddress;
    private final Instant occurredAt;

    protected EscrowEvent(String itemId, String buyerAddress, Instant occurredAt) {
        this.itemId = requireNonEmpty(itemId, "itemId");
        this.buyerAddress = requireNonEmpty(buyerAddress, "buyerAddress");
        this.occurredAt = requireNonNull(occurredAt, "occurredAt");
    }

    public abstract EscrowEventType getType();

    public String getItemId() {
        return itemId;
    }

    public String getBuyerAddress() {
        return buyerAddress;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
