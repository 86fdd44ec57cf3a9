package com.work.escrow.demo.web.dto;

import java.math.BigInteger;
import java.time.Instant;

/**
 * 挂牌与托管槽的合并视图。未上架时 listed=false，其余字段为空。
 */
public class ItemView {

    private String itemId;
    private boolean listed;
    private String seller;
    private BigInteger price;
    private boolean locked;
    private String slotState;
    private boolean purchasable;
    private String buyer;
    private BigInteger escrowedAmount;
    private Instant reservedAt;
    private boolean exclusive;

    public String getItemId() {
        return itemId;
    }

    public void setItemId(String itemId) {
        this.itemId = itemId;
    }

    public boolean isListed() {
        return listed;
    }

    public void setListed(boolean listed) {
        this.listed = listed;
    }

    public String getSeller() {
        return seller;
    }

    public void setSeller(String seller) {
        this.seller = seller;
    }

    public BigInteger getPrice() {
        return price;
    }

    public void setPrice(BigInteger price) {
        this.price = price;
    }

    public boolean isLocked() {
        return locked;
    }

    public void setLocked(boolean locked) {
        this.locked = locked;
    }

    public String getSlotState() {
        return slotState;
    }

    public void setSlotState(String slotState) {
        this.slotState = slotState;
    }

    public boolean isPurchasable() {
        return purchasable;
    }

    public void setPurchasable(boolean purchasable) {
        this.purchasable = purchasable;
    }

    public String getBuyer() {
        return buyer;
    }

    public void setBuyer(String buyer) {
        this.buyer = buyer;
    }

    public BigInteger getEscrowedAmount() {
        return escrowedAmount;
    }

    public void setEscrowedAmount(BigInteger escrowedAmount) {
        this.escrowedAmount = escrowedAmount;
    }

    public Instant getReservedAt() {
        return reservedAt;
    }

    public void setReservedAt(Instant reservedAt) {
        this.reservedAt = reservedAt;
    }

    public boolean isExclusive() {
        return exclusive;
    }

    public void setExclusive(boolean exclusive) {
        this.exclusive = exclusive;
    }
}
