package com.riskengine.event;

/**
 * Classifies the risk condition behind a {@link RiskEvent}.
 */
public enum RiskEventType {

    /** Margin level at or below the margin-call level. Notification only. */
    MARGIN_CALL,

    /** Margin level at or below the stop-out level; the worst position was liquidated. */
    STOP_OUT,

    /** Max or daily drawdown hit; every position liquidated and the account disabled. */
    ACCOUNT_BREACHED
}
