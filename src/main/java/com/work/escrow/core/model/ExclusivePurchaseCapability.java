package com.work.escrow.core.model;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;

import static com.work.escrow.core.support.ValidationUtils.requireNonEmpty;
import static com.work.escrow.core.support.ValidationUtils.requireNonNull;
import static com.work.escrow.core.support.ValidationUtils.requirePositive;

/**
 * 卖家签发给指定买家的独占购买凭证（锁价预留）：
 * 持有者可以不低于 minimumPrice 的金额购买该 item，绕过普通挂牌价校验。
 */
public final class ExclusivePurchaseCapability {

    private final String capabilityId;
    private final String itemId;
    private final String issuer;
    private final String buyerAddress;
    private final BigInteger minimumPrice;
    private final Instant issuedAt;

    public ExclusivePurchaseCapability(String capabilityId,
                                       String itemId,
                                       String issuer,
                                       String buyerAddress,
                                       BigInteger minimumPrice,
                                       Instant issuedAt) {
        this.capabilityId = requireNonEmpty(capabilityId, "capabilityId");
        this.itemId = requireNonEmpty(itemId, "itemId");
        this.issuer = requireNonEmpty(issuer, "issuer");
        this.buyerAddress = requireNonEmpty(buyerAddress, "buyerAddress");
        this.minimumPrice = requirePositive(minimumPrice, "minimumPrice");
        this.issuedAt = requireNonNull(issuedAt, "issuedAt");
    }

    public String getCapabilityId() {
        return capabilityId;
    }

    public String getItemId() {
        return itemId;
    }

    public String getIssuer() {
        return issuer;
    }

    public String getBuyerAddress() {
        return buyerAddress;
    }

    public BigInteger getMinimumPrice() {
        return minimumPrice;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return capabilityId.equals(((ExclusivePurchaseCapability) o).capabilityId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(capabilityId);
    }

    @Override
    public String toString() {
        return "ExclusivePurchaseCapability{" +
                "capabilityId='" + capabilityId + '\'' +
                ", itemId='" + itemId + '\'' +
                ", buyerAddress='" + buyerAddress + '\'' +
                ", minimumPrice=" + minimumPrice +
                '}';
    }
}
