package com.copytrader.domain.model;

import com.copytrader.domain.enums.EngineState;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Point-in-time view for external polling: active short-sale tasks and the order map. */
@Value
@Builder
public class EngineSnapshot {

    EngineState state;
    List<ShortSaleTask> activeTasks;

    /** Master order id to its follower links. */
    Map<String, List<FollowerOrderLink>> orderMap;

    int queuedActions;
    Instant capturedAt;
}
