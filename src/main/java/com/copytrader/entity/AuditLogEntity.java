package com.copytrader.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the audit_logs table.
 * Append-only trail of user decisions and configuration changes: reconciliation applies,
 * overrides, blacklist edits, queue replays and discards, engine lifecycle commands.
 */
@Entity
@Table(name = "audit_logs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_type", length = 50)
    private String eventType;

    @Column(name = "follower_id", length = 36)
    private String followerId;

    @Column(length = 20)
    private String symbol;

    @Column(length = 50)
    private String action;

    @Column(name = "details_json", columnDefinition = "CLOB")
    private String detailsJson;

    private Instant timestamp;
}
