package com.riskengine.event;

import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the margin monitor and the breach enforcer when an account crosses a
 * risk threshold.
 *
 * <p>Carries the account, the type of condition, its severity, a human-readable message
 * and a details map with condition-specific values (margin level, equity, threshold).
 * Notification channels subscribe to these; the engine itself never reacts to them.
 */
public class RiskEvent extends ApplicationEvent {

    private final String accountId;
    private final RiskEventType eventType;
    private final RiskLevel level;
    private final String message;
    private final Map<String, Object> details;

    public RiskEvent(
            Object source,
            String accountId,
            RiskEventType eventType,
            RiskLevel level,
            String message,
            Map<String, Object> details) {
        super(source);
        this.accountId = accountId;
        this.eventType = eventType;
        this.level = level;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public String getAccountId() {
        return accountId;
    }

    public RiskEventType getEventType() {
        return eventType;
    }

    public RiskLevel getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Condition-specific details. For example:
     * <ul>
     *   <li>MARGIN_CALL: {"marginLevel": 87.5, "threshold": 100}</li>
     *   <li>ACCOUNT_BREACHED: {"equity": 8950.00, "drawdownPct": 10.50}</li>
     * </ul>
     */
    public Map<String, Object> getDetails() {
        return details;
    }
}
