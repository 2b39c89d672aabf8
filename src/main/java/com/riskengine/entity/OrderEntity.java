package com.riskengine.entity;

import com.riskengine.domain.enums.OrderStatus;
import com.riskengine.domain.enums.OrderType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the orders table. Only SL/TP legs linked to a position are read by the engine.
 */
@Entity
@Table(name = "orders", indexes = @Index(name = "idx_orders_position_status", columnList = "position_id, status"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "position_id", length = 36)
    private String positionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "order_type", columnDefinition = "varchar(10)", nullable = false)
    private OrderType orderType;

    @Column(name = "stop_price", precision = 24, scale = 8)
    private BigDecimal stopPrice;

    @Column(precision = 24, scale = 8)
    private BigDecimal price;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(20)", nullable = false)
    private OrderStatus status;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
