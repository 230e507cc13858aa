package com.copytrader.entity;

import com.copytrader.domain.enums.MappingStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the order_mappings table.
 * One row per (master order, follower). Rows are overwritten on every status change and
 * never deleted, so a restart can still resolve cancel/replace events for live mappings.
 */
@Entity
@Table(
        name = "order_mappings",
        uniqueConstraints = @UniqueConstraint(columnNames = {"master_order_id", "follower_id"}),
        indexes = @Index(name = "idx_order_mappings_status", columnList = "status"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderMappingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "master_order_id", length = 100, nullable = false)
    private String masterOrderId;

    @Column(name = "follower_id", length = 36, nullable = false)
    private String followerId;

    @Column(length = 20)
    private String symbol;

    @Column(name = "follower_order_id", length = 100)
    private String followerOrderId;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(15)")
    private MappingStatus status;

    private long quantity;

    @Column(length = 500)
    private String error;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
