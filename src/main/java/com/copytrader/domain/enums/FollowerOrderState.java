package com.copytrader.domain.enums;

import java.util.Optional;

/** Order status reported by a follower session for an order the engine placed. */
public enum FollowerOrderState {
    ACCEPTED,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    REJECTED;

    /** Mapping status this update settles the follower's entry into, if any. */
    public Optional<MappingStatus> toMappingStatus() {
        return switch (this) {
            case FILLED -> Optional.of(MappingStatus.FILLED);
            case CANCELLED -> Optional.of(MappingStatus.CANCELLED);
            case REJECTED -> Optional.of(MappingStatus.FAILED);
            case ACCEPTED, PARTIALLY_FILLED -> Optional.empty();
        };
    }
}
