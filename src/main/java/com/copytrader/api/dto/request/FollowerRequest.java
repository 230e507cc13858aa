package com.copytrader.api.dto.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Registers or updates a follower. {@code accountId} is only read on registration; an
 * existing follower keeps its account binding.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FollowerRequest {

    private String id;

    @NotBlank
    private String name;

    @NotBlank
    private String accountId;

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal baseMultiplier;

    private Boolean enabled;

    /** Highest locate fee per share; engine default when absent. */
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal maxLocatePrice;

    @Positive
    private Integer locateTimeoutSeconds;
}
