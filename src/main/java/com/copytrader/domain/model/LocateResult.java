package com.copytrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LocateResult {

    String symbol;
    long requestedQuantity;
    long filledQuantity;
    BigDecimal pricePerShare;
    boolean accepted;
    String message;
}
