package com.copytrader.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A follower account mirroring the master.
 *
 * <p>{@code maxLocatePrice} and {@code locateTimeoutSeconds} are the per-follower locate
 * parameters handed to the borrow acquisition workflow; when absent the engine-wide
 * defaults apply.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Follower {

    private String id;
    private String name;
    private String accountId;

    @Builder.Default
    private BigDecimal baseMultiplier = BigDecimal.ONE;

    @Builder.Default
    private boolean enabled = true;

    /** Maximum price per share the follower accepts for a locate. */
    private BigDecimal maxLocatePrice;

    private Integer locateTimeoutSeconds;
}
