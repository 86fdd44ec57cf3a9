package com.work.escrow.demo.web.dto;

import java.math.BigInteger;
import java.util.UUID;

/**
 * submitResponse 的结果：SETTLED 时携带收据与新所有者，REFUNDED 时仅有退款金额。
 */
public class OutcomeView {

    private String outcome;
    private String itemId;
    private String buyer;
    private BigInteger amount;
    private String capabilityDisposition;
    private UUID receiptId;
    private String newOwner;

    public String getOutcome() {
        return outcome;
    }

    public void setOutcome(String outcome) {
        this.outcome = outcome;
    }

    public String getItemId() {
        return itemId;
    }

    public void setItemId(String itemId) {
        this.itemId = itemId;
    }

    public String getBuyer() {
        return buyer;
    }

    public void setBuyer(String buyer) {
        this.buyer = buyer;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public void setAmount(BigInteger amount) {
        this.amount = amount;
    }

    public String getCapabilityDisposition() {
        return capabilityDisposition;
    }

    public void setCapabilityDisposition(String capabilityDisposition) {
        this.capabilityDisposition = capabilityDisposition;
    }

    public UUID getReceiptId() {
        return receiptId;
    }

    public void setReceiptId(UUID receiptId) {
        this.receiptId = receiptId;
    }

    public String getNewOwner() {
        return newOwner;
    }

    public void setNewOwner(String newOwner) {
        this.newOwner = newOwner;
    }
}
