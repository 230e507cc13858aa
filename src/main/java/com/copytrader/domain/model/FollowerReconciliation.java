package com.copytrader.domain.model;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Reconciliation entries for one follower. {@code error} is set when positions could not be read. */
@Value
@Builder
public class FollowerReconciliation {

    String followerId;
    String followerName;
    BigDecimal baseMultiplier;
    boolean connected;
    List<ReconciliationEntry> entries;
    String error;
}
