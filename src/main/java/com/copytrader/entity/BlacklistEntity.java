package com.copytrader.entity;

import com.copytrader.domain.enums.BlacklistReason;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "blacklist", uniqueConstraints = @UniqueConstraint(columnNames = {"follower_id", "symbol"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BlacklistEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "follower_id", length = 36, nullable = false)
    private String followerId;

    @Column(length = 20, nullable = false)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(20)")
    private BlacklistReason reason;

    @Column(name = "created_at")
    private Instant createdAt;
}
