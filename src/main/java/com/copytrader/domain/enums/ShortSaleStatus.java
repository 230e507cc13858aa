package com.copytrader.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * State machine for a short-sale task on one follower.
 *
 * <p>Valid transitions:
 * <pre>
 * PENDING -> CHECKING -> LOCATING -> PLACING_ORDER -> COMPLETED
 *               |            |              |
 *               +-----+------+------+-------+
 *                     v             v
 *                   FAILED      CANCELLED (from any non-terminal state)
 * </pre>
 *
 * <p>CHECKING may go straight to PLACING_ORDER when the follower already has enough
 * sell capacity and no locate is needed.
 */
public enum ShortSaleStatus {

    /** Created, waiting for the per-symbol lock. */
    PENDING,

    /** Holding the per-symbol lock, querying sell capacity. */
    CHECKING,

    /** Waiting for a global locate slot or for the locate call itself. */
    LOCATING,

    /** Submitting the follower order. */
    PLACING_ORDER,

    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(ShortSaleStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<ShortSaleStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(CHECKING, CANCELLED);
            case CHECKING -> EnumSet.of(LOCATING, PLACING_ORDER, FAILED, CANCELLED);
            case LOCATING -> EnumSet.of(PLACING_ORDER, FAILED, CANCELLED);
            case PLACING_ORDER -> EnumSet.of(COMPLETED, FAILED, CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(ShortSaleStatus.class);
        };
    }
}
