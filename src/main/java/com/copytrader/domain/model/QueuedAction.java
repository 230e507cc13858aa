package com.copytrader.domain.model;

import com.copytrader.domain.enums.QueuedActionType;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * An action held for a follower that was unreachable at dispatch time. The master event is
 * kept whole: for REPLACE it carries the new quantity and price, for a short-sale SUBMIT it
 * re-enters the full borrow workflow on replay.
 */
@Value
@Builder
public class QueuedAction {

    String id;
    String followerId;
    QueuedActionType type;
    MasterOrderEvent masterEvent;
    Instant enqueuedAt;

    public String getMasterOrderId() {
        return masterEvent.getMasterOrderId();
    }

    public String getSymbol() {
        return masterEvent.getSymbol();
    }
}
