package com.copytrader.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReconciliationApplyResult {

    int decisionsApplied;
    int multiplierOverridesSet;
    int multiplierOverridesRemoved;
    int blacklistAdded;
    int blacklistRemoved;
}
