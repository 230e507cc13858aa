package com.copytrader.api.dto.response;

import com.copytrader.domain.enums.EngineState;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EngineStatusResponse {

    EngineState state;
    boolean reconciliationGateOpen;

    /** "master" first, then follower ids. */
    Map<String, Boolean> connections;

    int activeShortSaleTasks;
    int queuedActions;
    int intakeBacklog;
}
