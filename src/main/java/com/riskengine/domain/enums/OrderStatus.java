package com.riskengine.domain.enums;

/**
 * Lifecycle status of an SL/TP order.
 * An order leaves PENDING exactly once, to either FILLED or CANCELLED.
 */
public enum OrderStatus {
    PENDING,
    FILLED,
    CANCELLED
}
