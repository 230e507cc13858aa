package com.copytrader.domain.model;

import com.copytrader.domain.enums.MappingStatus;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One follower's entry under a master order. A replace overwrites {@code followerOrderId}
 * in place; terminal statuses are kept, never deleted.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FollowerOrderLink {

    private String masterOrderId;
    private String followerId;
    private String symbol;

    /** Null until the follower order has been placed. */
    private String followerOrderId;

    private MappingStatus status;
    private long quantity;
    private String error;
    private Instant createdAt;
    private Instant updatedAt;
}
