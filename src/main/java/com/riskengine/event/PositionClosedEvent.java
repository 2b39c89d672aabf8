package com.riskengine.event;

import com.riskengine.domain.model.CloseResult;
import com.riskengine.domain.model.Position;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a position has been settled by the engine.
 * Carries the position as it was read before the close and the settlement outcome.
 */
public class PositionClosedEvent extends ApplicationEvent {

    private final Position position;
    private final CloseResult result;

    public PositionClosedEvent(Object source, Position position, CloseResult result) {
        super(source);
        this.position = position;
        this.result = result;
    }

    public Position getPosition() {
        return position;
    }

    public CloseResult getResult() {
        return result;
    }
}
