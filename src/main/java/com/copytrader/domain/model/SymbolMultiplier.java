package com.copytrader.domain.model;

import com.copytrader.domain.enums.MultiplierSource;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SymbolMultiplier {

    private String followerId;
    private String symbol;
    private BigDecimal multiplier;
    private MultiplierSource source;
}
