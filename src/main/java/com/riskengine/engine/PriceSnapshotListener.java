package com.riskengine.engine;

import com.riskengine.event.PriceSnapshotEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Forwards price snapshots published by the market data stream to the risk engine.
 * Runs on the publisher's thread.
 */
@Component
public class PriceSnapshotListener {

    private final PositionRiskEngine positionRiskEngine;

    public PriceSnapshotListener(PositionRiskEngine positionRiskEngine) {
        this.positionRiskEngine = positionRiskEngine;
    }

    @EventListener
    public void onPriceSnapshot(PriceSnapshotEvent event) {
        positionRiskEngine.evaluate(event.getPrices());
    }
}
