package com.copytrader.domain.model;

import com.copytrader.domain.enums.MasterEventType;
import com.copytrader.domain.enums.OrderSide;
import com.copytrader.domain.enums.OrderType;
import com.copytrader.domain.enums.TimeInForce;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable record of an accepted, cancelled or replaced order on the master account.
 *
 * <p>Produced by the master session's order subscription and consumed once by the engine's
 * dispatch loop. For REPLACED events {@code quantity} and {@code price} carry the new values;
 * for CANCELLED events only the identifier and symbol are meaningful.
 */
@Value
@Builder
public class MasterOrderEvent {

    String masterOrderId;
    MasterEventType type;
    String symbol;
    OrderSide side;
    long quantity;
    OrderType orderType;

    /** Limit price. Null for MARKET and STOP orders. */
    BigDecimal price;

    /** Stop trigger. Used by STOP and STOP_LIMIT orders. */
    BigDecimal stopPrice;

    /** Trail offset for TRAILING_STOP orders. */
    BigDecimal trailAmount;

    TimeInForce timeInForce;

    /** Venue route on the master; probe orders use a reserved route and are never copied. */
    String route;

    @Builder.Default
    Instant receivedAt = Instant.now();
}
