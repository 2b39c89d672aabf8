package com.riskengine.event;

/**
 * Severity level for a {@link RiskEvent}.
 *
 * <p>WARNING needs the trader's attention but the engine takes no action. CRITICAL means the
 * engine already acted (stop-out, breach).
 */
public enum RiskLevel {
    WARNING,
    CRITICAL
}
