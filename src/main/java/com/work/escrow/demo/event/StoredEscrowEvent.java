package com.work.escrow.demo.event;

import com.work.escrow.core.event.EscrowEventType;

import java.time.Instant;

/**
 * 已落存储的事件记录，seq 单调递增，供调用方按游标轮询。
 * challengeHex 仅 CHALLENGE_ISSUED 事件有值。
 */
public class StoredEscrowEvent {

    private final long seq;
    private final EscrowEventType type;
    private final String itemId;
    private final String buyerAddress;
    private final String challengeHex;
    private final Instant occurredAt;

    public StoredEscrowEvent(long seq, EscrowEventType type, String itemId, String buyerAddress,
                             String challengeHex, Instant occurredAt) {
        this.seq = seq;
        this.type = type;
        this.itemId = itemId;
        this.buyerAddress = buyerAddress;
        this.challengeHex = challengeHex;
        this.occurredAt = occurredAt;
    }

    public long getSeq() {
        return seq;
    }

    public EscrowEventType getType() {
        return type;
    }

    public String getItemId() {
        return itemId;
    }

    public String getBuyerAddress() {
        return buyerAddress;
    }

    public String getChallengeHex() {
        return challengeHex;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
