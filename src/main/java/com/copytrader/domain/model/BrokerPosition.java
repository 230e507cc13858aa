package com.copytrader.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Position snapshot row. Quantity is signed: negative means short. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BrokerPosition {

    private String symbol;
    private long quantity;
    private BigDecimal averagePrice;
}
