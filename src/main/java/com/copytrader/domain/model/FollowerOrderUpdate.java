package com.copytrader.domain.model;

import com.copytrader.domain.enums.FollowerOrderState;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FollowerOrderUpdate {

    String followerId;
    String followerOrderId;
    FollowerOrderState state;
    long filledQuantity;
    String message;
}
