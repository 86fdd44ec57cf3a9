package com.work.escrow.core.event;

import java.time.Instant;

import static com.work.escrow.core.support.ValidationUtils.requireNonEmpty;

/**
 * 买家预留成功时发出，卖家据此取得需要求解的挑战。
 */
public final class ChallengeIssuedEvent extends EscrowEvent {

    private final byte[] challenge;

    public ChallengeIssuedEvent(String itemId, byte[] challenge, String buyerAddress, Instant occurredAt) {
        super(itemId, buyerAddress, occurredAt);
        this.challenge = requireNonEmpty(challenge, "challenge").clone();
    }

    @Override
    public EscrowEventType getType() {
        return EscrowEventType.CHALLENGE_ISSUED;
    }

    public byte[] getChallenge() {
        return challenge.clone();
    }
}
