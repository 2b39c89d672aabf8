package com.riskengine.domain.enums;

/**
 * Direction of a leveraged position.
 * LONG closes by selling at the bid, SHORT closes by buying at the ask.
 */
public enum PositionDirection {
    LONG,
    SHORT
}
