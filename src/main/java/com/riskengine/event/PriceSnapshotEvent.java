package com.riskengine.event;

import com.riskengine.domain.model.PriceTick;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the price-streaming collaborator with the latest normalized quote per symbol
 * (roughly every 500ms). The risk engine consumes it; its own throttle decides whether a
 * snapshot triggers an evaluation pass.
 */
public class PriceSnapshotEvent extends ApplicationEvent {

    private final Map<String, PriceTick> prices;

    public PriceSnapshotEvent(Object source, Map<String, PriceTick> prices) {
        super(source);
        this.prices = Map.copyOf(prices);
    }

    public Map<String, PriceTick> getPrices() {
        return prices;
    }
}
