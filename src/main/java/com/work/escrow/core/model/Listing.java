package com.work.escrow.core.model;

import java.math.BigInteger;
import java.time.Instant;

import static com.work.escrow.core.support.ValidationUtils.requireNonEmpty;
import static com.work.escrow.core.support.ValidationUtils.requireNonNull;
import static com.work.escrow.core.support.ValidationUtils.requirePositive;

/**
 * ledger 中一条挂牌记录的只读快照。
 * lockedCapabilityId 非空表示卖家已锁价签发独占凭证，只能走凭证购买路径。
 */
public final class Listing {

    private final String itemId;
    private final String seller;
    private final BigInteger price;
    private final Instant listedAt;
    private final String lockedCapabilityId;

    public Listing(String itemId, String seller, BigInteger price, Instant listedAt, String lockedCapabilityId) {
        this.itemId = requireNonEmpty(itemId, "itemId");
        this.seller = requireNonEmpty(seller, "seller");
        this.price = requirePositive(price, "price");
        this.listedAt = requireNonNull(listedAt, "listedAt");
        this.lockedCapabilityId = lockedCapabilityId;
    }

    public String getItemId() {
        return itemId;
    }

    public String getSeller() {
        return seller;
    }

    public BigInteger getPrice() {
        return price;
    }

    public Instant getListedAt() {
        return listedAt;
    }

    public String getLockedCapabilityId() {
        return lockedCapabilityId;
    }

    public boolean isLocked() {
        return lockedCapabilityId != null;
    }

    public Listing withLock(String capabilityId) {
        return new Listing(itemId, seller, price, listedAt, capabilityId);
    }
}
