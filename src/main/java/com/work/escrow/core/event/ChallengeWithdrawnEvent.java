package com.work.escrow.core.event;

import java.time.Instant;

public final class ChallengeWithdrawnEvent extends EscrowEvent {

    public ChallengeWithdrawnEvent(String itemId, String buyerAddress, Instant occurredAt) {
        super(itemId, buyerAddress, occurredAt);
    }

    @Override
    public EscrowEventType getType() {
        return EscrowEventType.CHALLENGE_WITHDRAWN;
    }
}
