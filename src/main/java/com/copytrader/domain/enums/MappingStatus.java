package com.copytrader.domain.enums;

/**
 * Status of one follower's entry in an order mapping.
 * PENDING and ACTIVE are live: cancel and replace events are forwarded to the follower.
 * SKIPPED means the follower was unreachable at dispatch and the submit sits in the action queue.
 */
public enum MappingStatus {
    PENDING,
    ACTIVE,
    FILLED,
    CANCELLED,
    FAILED,
    SKIPPED;

    public boolean isLive() {
        return this == PENDING || this == ACTIVE;
    }
}
