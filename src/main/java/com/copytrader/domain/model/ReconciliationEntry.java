package com.copytrader.domain.model;

import com.copytrader.domain.enums.MultiplierSource;
import com.copytrader.domain.enums.ReconciliationAction;
import com.copytrader.domain.enums.ReconciliationScenario;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Comparison of one master-held symbol against one follower. Computed on demand and consumed
 * by the apply step; never persisted.
 */
@Value
@Builder
public class ReconciliationEntry {

    String symbol;

    /** Signed; negative means short. */
    long masterQuantity;

    long followerQuantity;
    ReconciliationScenario scenario;

    /** |follower| / |master|, present only for COMMON_SAME_DIRECTION. */
    BigDecimal inferredMultiplier;

    BigDecimal currentMultiplier;
    MultiplierSource currentSource;
    boolean blacklisted;
    ReconciliationAction defaultAction;
}
