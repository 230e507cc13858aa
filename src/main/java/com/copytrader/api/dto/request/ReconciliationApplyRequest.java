package com.copytrader.api.dto.request;

import com.copytrader.domain.enums.DecisionAction;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** User-confirmed reconciliation decisions. An empty list applies nothing and opens the gate. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationApplyRequest {

    @NotNull
    @Valid
    private List<Decision> decisions;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Decision {

        @NotBlank
        private String followerId;

        @NotBlank
        private String symbol;

        @NotNull
        private DecisionAction action;

        /** Required for USE_INFERRED and MANUAL. */
        private BigDecimal multiplier;

        private boolean blacklist;
    }
}
