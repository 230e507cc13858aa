package com.copytrader.api.dto.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MultiplierOverrideRequest {

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal multiplier;
}
