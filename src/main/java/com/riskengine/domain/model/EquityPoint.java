package com.riskengine.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One point of the account equity curve, appended after every settlement.
 * {@code equity} holds the post-close available margin.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EquityPoint {

    private Long id;
    private String accountId;
    private BigDecimal equity;
    private BigDecimal pnl;
    private Instant recordedAt;
}
