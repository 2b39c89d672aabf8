package com.riskengine.domain.model;

import com.riskengine.domain.enums.CloseReason;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * The close-only fields written to a position in a single conditional update.
 */
@Value
@Builder
public class PositionClosure {

    String positionId;
    BigDecimal exitPrice;
    Instant exitTimestamp;
    BigDecimal realizedPnl;
    CloseReason closeReason;
    BigDecimal totalFees;
}
