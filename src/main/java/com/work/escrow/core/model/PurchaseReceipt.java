package com.work.escrow.core.model;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * ledger 完成“付款换物品”后出具的回执。
 */
public final class PurchaseReceipt {

    private final UUID receiptId;
    private final String itemId;
    private final String seller;
    private final String buyer;
    private final BigInteger amount;
    private final Instant settledAt;

    public PurchaseReceipt(UUID receiptId, String itemId, String seller, String buyer,
                           BigInteger amount, Instant settledAt) {
        this.receiptId = receiptId;
        this.itemId = itemId;
        this.seller = seller;
        this.buyer = buyer;
        this.amount = amount;
        this.settledAt = settledAt;
    }

    public UUID getReceiptId() {
        return receiptId;
    }

    public String getItemId() {
        return itemId;
    }

    public String getSeller() {
        return seller;
    }

    public String getBuyer() {
        return buyer;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public Instant getSettledAt() {
        return settledAt;
    }

    @Override
    public String toString() {
        return "PurchaseReceipt{" +
                "receiptId=" + receiptId +
                ", itemId='" + itemId + '\'' +
                ", seller='" + seller + '\'' +
                ", buyer='" + buyer + '\'' +
                ", amount=" + amount +
                ", settledAt=" + settledAt +
                '}';
    }
}
