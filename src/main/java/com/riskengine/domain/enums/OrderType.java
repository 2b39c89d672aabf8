package com.riskengine.domain.enums;

/**
 * Conditional close legs attached to an open position.
 * STOP is the stop-loss leg, LIMIT is the take-profit leg.
 */
public enum OrderType {
    STOP,
    LIMIT
}
