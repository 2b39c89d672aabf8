package com.riskengine.domain.enums;

/**
 * Why a position was closed. MANUAL closes come from the trader; the engine only
 * ever writes SL, TP and LIQUIDATION.
 */
public enum CloseReason {
    MANUAL("Closed"),
    SL("SL"),
    TP("TP"),
    LIQUIDATION("Liquidation");

    private final String label;

    CloseReason(String label) {
        this.label = label;
    }

    /** Short label used in activity titles. */
    public String getLabel() {
        return label;
    }
}
