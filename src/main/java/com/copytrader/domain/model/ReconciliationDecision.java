package com.copytrader.domain.model;

import com.copytrader.domain.enums.DecisionAction;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * User-confirmed decision for one (follower, symbol). {@code multiplier} is required for
 * USE_INFERRED and MANUAL; {@code blacklist} adds the symbol when true and removes it when false.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationDecision {

    private String followerId;
    private String symbol;
    private DecisionAction action;
    private BigDecimal multiplier;
    private boolean blacklist;
}
