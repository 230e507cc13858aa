package com.copytrader.api.dto.request;

import com.copytrader.domain.enums.BlacklistReason;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Adds a (follower, symbol) to the blacklist. The reason defaults to MANUAL. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlacklistRequest {

    @NotBlank
    private String followerId;

    @NotBlank
    private String symbol;

    private BlacklistReason reason;
}
