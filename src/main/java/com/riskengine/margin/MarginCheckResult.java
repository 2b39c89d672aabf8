package com.riskengine.margin;

import java.math.BigDecimal;
import lombok.Getter;

/**
 * Outcome of one account's margin check. {@code marginLevel} is null when the account has
 * no margin in use.
 */
@Getter
public class MarginCheckResult {

    public enum State {
        NOT_APPLICABLE,
        HEALTHY,
        MARGIN_CALL,
        STOP_OUT
    }

    private static final MarginCheckResult NOT_APPLICABLE = new MarginCheckResult(State.NOT_APPLICABLE, null);

    private final State state;
    private final BigDecimal marginLevel;

    private MarginCheckResult(State state, BigDecimal marginLevel) {
        this.state = state;
        this.marginLevel = marginLevel;
    }

    public static MarginCheckResult notApplicable() {
        return NOT_APPLICABLE;
    }

    public static MarginCheckResult of(State state, BigDecimal marginLevel) {
        return new MarginCheckResult(state, marginLevel);
    }

    public boolean isStopOut() {
        return state == State.STOP_OUT;
    }
}
