package com.riskengine.api.dto.response;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * Snapshot of the risk engine's runtime state for the monitoring dashboard.
 */
@Getter
@Builder
public class EngineStatusResponse {

    private final Instant lastEvaluationAt;
    private final long evaluationIntervalMillis;
    private final long admittedTicks;
    private final long throttledTicks;
    private final Thresholds thresholds;

    @Getter
    @Builder
    public static class Thresholds {
        private final BigDecimal feeRate;
        private final BigDecimal marginCallLevel;
        private final BigDecimal stopOutLevel;
        private final BigDecimal maxDrawdownPct;
        private final BigDecimal dailyDrawdownPct;
        private final long priceStaleAfterMillis;
    }
}
