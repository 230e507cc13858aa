package com.copytrader.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Outcome of replaying queued actions for one follower. */
@Value
@Builder
public class ReplayResult {

    String followerId;
    List<String> replayedActionIds;

    /** Actions dropped at replay because their symbol was blacklisted meanwhile. */
    List<String> skippedActionIds;
}
