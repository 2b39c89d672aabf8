package com.riskengine.domain.enums;

/**
 * Lifecycle status of a position. CLOSED is terminal.
 */
public enum PositionStatus {
    OPEN,
    CLOSED
}
