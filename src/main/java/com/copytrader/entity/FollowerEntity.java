package com.copytrader.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the followers table.
 * One row per follower account; the locate columns are optional per-follower overrides of
 * the engine-wide locate defaults.
 */
@Entity
@Table(name = "followers")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FollowerEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(length = 100, nullable = false)
    private String name;

    @Column(name = "account_id", length = 50, nullable = false, unique = true)
    private String accountId;

    @Column(name = "base_multiplier", precision = 12, scale = 4, nullable = false)
    private BigDecimal baseMultiplier;

    private boolean enabled;

    @Column(name = "max_locate_price", precision = 10, scale = 4)
    private BigDecimal maxLocatePrice;

    @Column(name = "locate_timeout_seconds")
    private Integer locateTimeoutSeconds;
}
