package com.riskengine.domain.model;

import com.riskengine.domain.enums.CloseReason;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;

/**
 * Outcome of a single position close. A result with {@code closed = false} means the
 * close was a no-op: the position was no longer open, or its account was not found.
 */
@Getter
@Builder
public class CloseResult {

    private final String positionId;
    private final boolean closed;
    private final CloseReason closeReason;
    private final BigDecimal exitPrice;
    private final BigDecimal realizedPnl;
    private final BigDecimal closeFee;
    private final BigDecimal newNetWorth;
    private final BigDecimal newAvailableMargin;
    private final String skipReason;

    public static CloseResult skipped(String positionId, String reason) {
        return CloseResult.builder()
                .positionId(positionId)
                .closed(false)
                .skipReason(reason)
                .build();
    }
}
