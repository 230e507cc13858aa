package com.copytrader.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReconciliationReport {

    /** Non-zero master positions by symbol. */
    Map<String, Long> masterPositions;

    List<FollowerReconciliation> followers;
    Instant computedAt;
}
