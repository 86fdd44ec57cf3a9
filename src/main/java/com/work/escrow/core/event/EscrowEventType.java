package com.work.escrow.core.event;

public enum EscrowEventType {
    CHALLENGE_ISSUED,
    CHALLENGE_WITHDRAWN
}
