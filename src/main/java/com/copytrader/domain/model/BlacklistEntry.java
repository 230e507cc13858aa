package com.copytrader.domain.model;

import com.copytrader.domain.enums.BlacklistReason;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Presence alone excludes the symbol for the follower; the reason is informational. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlacklistEntry {

    private String followerId;
    private String symbol;
    private BlacklistReason reason;
    private Instant createdAt;
}
