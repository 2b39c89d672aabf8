package com.riskengine.domain.model;

import com.riskengine.domain.enums.CloseReason;
import com.riskengine.domain.enums.PositionDirection;
import com.riskengine.domain.enums.PositionStatus;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A leveraged position held by a trading account.
 *
 * <p>Positions are opened by the order placement flow and only ever mutated to
 * CLOSED, either by the risk engine or by a manual close. The close-only fields
 * (exit price, exit timestamp, realized P&L, close reason, total fees) are written
 * together in one conditional update and never change afterwards.
 *
 * <p>Quantity is always positive; the side lives in {@link #direction}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String id;
    private String accountId;
    private String symbol;
    private PositionDirection direction;

    private BigDecimal quantity;
    private int leverage;
    private BigDecimal entryPrice;

    /** Collateral reserved for this position, released back to available margin on close. */
    private BigDecimal isolatedMargin;

    /** Fees accrued before close (entry fee). */
    private BigDecimal tradeFees;

    private PositionStatus status;

    private BigDecimal exitPrice;
    private Instant exitTimestamp;
    private BigDecimal realizedPnl;
    private CloseReason closeReason;
    private BigDecimal totalFees;

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }

    public boolean isLong() {
        return direction == PositionDirection.LONG;
    }
}
