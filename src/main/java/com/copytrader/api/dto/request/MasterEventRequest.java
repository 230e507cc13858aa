package com.copytrader.api.dto.request;

import com.copytrader.domain.enums.MasterEventType;
import com.copytrader.domain.enums.OrderSide;
import com.copytrader.domain.enums.OrderType;
import com.copytrader.domain.enums.TimeInForce;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Master order event injected into the simulator's master session. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MasterEventRequest {

    @NotBlank
    private String masterOrderId;

    @NotNull
    private MasterEventType type;

    @NotBlank
    private String symbol;

    @NotNull
    private OrderSide side;

    @PositiveOrZero
    private long quantity;

    private OrderType orderType;
    private BigDecimal price;
    private BigDecimal stopPrice;
    private BigDecimal trailAmount;
    private TimeInForce timeInForce;
    private String route;
}
