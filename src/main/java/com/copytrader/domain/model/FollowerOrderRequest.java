package com.copytrader.domain.model;

import com.copytrader.domain.enums.OrderSide;
import com.copytrader.domain.enums.OrderType;
import com.copytrader.domain.enums.TimeInForce;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Order as submitted to a follower session. Everything except quantity comes from the master. */
@Value
@Builder
public class FollowerOrderRequest {

    String symbol;
    OrderSide side;
    OrderType orderType;
    long quantity;
    BigDecimal price;
    BigDecimal stopPrice;
    BigDecimal trailAmount;
    TimeInForce timeInForce;

    /** Master order this request replicates; used only for tracing on the follower side. */
    String masterOrderId;
}
