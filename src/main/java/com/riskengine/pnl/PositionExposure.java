package com.riskengine.pnl;

import com.riskengine.domain.model.Position;
import java.math.BigDecimal;
import lombok.Getter;

/**
 * One position marked to market. {@code exitPrice} is null when no fresh quote exists.
 */
@Getter
public class PositionExposure {

    private final Position position;
    private final BigDecimal exitPrice;
    private final BigDecimal unrealizedPnl;

    public PositionExposure(Position position, BigDecimal exitPrice, BigDecimal unrealizedPnl) {
        this.position = position;
        this.exitPrice = exitPrice;
        this.unrealizedPnl = unrealizedPnl;
    }

    public boolean isPriced() {
        return exitPrice != null;
    }
}
