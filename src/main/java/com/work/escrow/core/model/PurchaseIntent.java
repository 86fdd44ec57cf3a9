package com.work.escrow.core.model;

import java.time.Instant;
import java.util.Optional;

import static com.work.escrow.core.support.ValidationUtils.requireNonEmpty;
import static com.work.escrow.core.support.ValidationUtils.requireNonNull;

/**
 * 托管记录：由 purchase 创建，在被处置前由托管槽独占持有。
 *
 * 注意：
 * 1. 所有字段不可变，字节数组在进出时都会拷贝
 * 2. escrowedFunds 的金额在结算时全额转给卖家，或在退款时全额退回买家，不允许拆分
 * 3. exclusiveCapability 可选，结算时被消耗，其余销毁路径必须归还
 */
public final class PurchaseIntent {

    private final String itemId;
    private final byte[] challenge;
    private final byte[] buyerPublicKey;
    private final HeldFunds escrowedFunds;
    private final String buyerAddress;
    private final ExclusivePurchaseCapability exclusiveCapability;
    private final Instant reservedAt;

    public PurchaseIntent(String itemId,
                          byte[] challenge,
                          byte[] buyerPublicKey,
                          HeldFunds escrowedFunds,
                          String buyerAddress,
                          ExclusivePurchaseCapability exclusiveCapability,
                          Instant reservedAt) {
        this.itemId = requireNonEmpty(itemId, "itemId");
        this.challenge = requireNonEmpty(challenge, "challenge").clone();
        this.buyerPublicKey = requireNonEmpty(buyerPublicKey, "buyerPublicKey").clone();
        this.escrowedFunds = requireNonNull(escrowedFunds, "escrowedFunds");
        this.buyerAddress = requireNonEmpty(buyerAddress, "buyerAddress");
        this.exclusiveCapability = exclusiveCapability;
        this.reservedAt = requireNonNull(reservedAt, "reservedAt");
    }

    public String getItemId() {
        return itemId;
    }

    public byte[] getChallenge() {
        return challenge.clone();
    }

    public byte[] getBuyerPublicKey() {
        return buyerPublicKey.clone();
    }

    public HeldFunds getEscrowedFunds() {
        return escrowedFunds;
    }

    public String getBuyerAddress() {
        return buyerAddress;
    }

    public Optional<ExclusivePurchaseCapability> getExclusiveCapability() {
        return Optional.ofNullable(exclusiveCapability);
    }

    public Instant getReservedAt() {
        return reservedAt;
    }

    @Override
    public String toString() {
        return "PurchaseIntent{" +
                "itemId='" + itemId + '\'' +
                ", challengeLength=" + challenge.length +
                ", buyerPublicKeyLength=" + buyerPublicKey.length +
                ", escrowedFunds=" + escrowedFunds +
                ", buyerAddress='" + buyerAddress + '\'' +
                ", exclusiveCapability=" + exclusiveCapability +
                ", reservedAt=" + reservedAt +
                '}';
    }
}
