package com.copytrader.entity;

import com.copytrader.domain.enums.MultiplierSource;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** JPA entity for the symbol_multipliers table. Only user overrides are stored. */
@Entity
@Table(
        name = "symbol_multipliers",
        uniqueConstraints = @UniqueConstraint(columnNames = {"follower_id", "symbol"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SymbolMultiplierEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "follower_id", length = 36, nullable = false)
    private String followerId;

    @Column(length = 20, nullable = false)
    private String symbol;

    @Column(precision = 12, scale = 4, nullable = false)
    private BigDecimal multiplier;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(15)")
    private MultiplierSource source;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
