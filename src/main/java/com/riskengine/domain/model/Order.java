package com.riskengine.domain.model;

import com.riskengine.domain.enums.OrderStatus;
import com.riskengine.domain.enums.OrderType;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Stop-loss or take-profit leg linked to an open position.
 *
 * <p>STOP orders carry their level in {@code stopPrice}, LIMIT orders in {@code price}.
 * At most one live SL and one live TP are expected per position.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    private String id;
    private String positionId;
    private OrderType orderType;
    private BigDecimal stopPrice;
    private BigDecimal price;
    private OrderStatus status;
    private Instant updatedAt;

    /** The level that arms this leg: stopPrice for STOP, price for LIMIT. */
    public BigDecimal getTriggerLevel() {
        return orderType == OrderType.STOP ? stopPrice : price;
    }
}
