package com.copytrader.domain.enums;

/**
 * Classification of one symbol held by the master when compared with a follower.
 * Symbols held only by the follower are never classified; the master will not act on them.
 */
public enum ReconciliationScenario {

    /** Both long or both short; an inferred multiplier is available. */
    COMMON_SAME_DIRECTION,

    /** Follower holds the symbol in the opposite direction. */
    COMMON_OPPOSITE_DIRECTION,

    /** Follower holds no position in the symbol. */
    MASTER_ONLY
}
