package com.riskengine.domain.model;

import com.riskengine.domain.enums.ActivityType;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Append-only, human-readable audit entry shown in the account's activity feed.
 * P&L is null for breach entries.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityRecord {

    private Long id;
    private String accountId;
    private ActivityType type;
    private String title;
    private String detail;
    private BigDecimal pnl;
    private Instant occurredAt;
}
