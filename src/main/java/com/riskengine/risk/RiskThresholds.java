package com.riskengine.risk;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Builder;
import lombok.Data;

/**
 * Risk engine thresholds and pass limits.
 *
 * <p>Organized into three groups:
 * <ul>
 *   <li><b>Settlement:</b> fee rate charged on the exit notional</li>
 *   <li><b>Margin:</b> margin-call and stop-out levels, in percent of margin used</li>
 *   <li><b>Drawdown:</b> max drawdown against the starting balance and daily drawdown
 *       against the intraday baseline, as fractions</li>
 * </ul>
 *
 * <p>Loaded from application.properties ({@code riskengine.*}) by
 * {@link com.riskengine.config.RiskEngineConfig}. {@link #defaults()} carries the
 * production values and is what unit tests start from.
 */
@Data
@Builder(toBuilder = true)
public class RiskThresholds {

    // ==================== Settlement ====================

    /** Close fee as a fraction of exit notional (0.0007 = 0.07%). */
    private BigDecimal feeRate;

    // ==================== Margin ====================

    /** Margin level (percent) at or below which a margin call is raised. Notification only. */
    private BigDecimal marginCallLevel;

    /** Margin level (percent) at or below which the worst position is liquidated. */
    private BigDecimal stopOutLevel;

    // ==================== Drawdown ====================

    /** Maximum loss from the starting balance as a fraction (0.10 = 10%). */
    private BigDecimal maxDrawdownPct;

    /** Maximum loss from the intraday baseline as a fraction (0.05 = 5%). */
    private BigDecimal dailyDrawdownPct;

    // ==================== Pass control ====================

    /** Minimum time between two admitted evaluation passes. */
    private Duration minEvaluationInterval;

    /** Quotes older than this are treated as missing. */
    private Duration priceStaleAfter;

    private int maxOpenPositionsPerScan;

    private int maxPendingOrdersPerScan;

    private int dailyResetBatchSize;

    public static RiskThresholds defaults() {
        return RiskThresholds.builder()
                .feeRate(new BigDecimal("0.0007"))
                .marginCallLevel(new BigDecimal("100"))
                .stopOutLevel(new BigDecimal("50"))
                .maxDrawdownPct(new BigDecimal("0.10"))
                .dailyDrawdownPct(new BigDecimal("0.05"))
                .minEvaluationInterval(Duration.ofSeconds(2))
                .priceStaleAfter(Duration.ofSeconds(30))
                .maxOpenPositionsPerScan(500)
                .maxPendingOrdersPerScan(1000)
                .dailyResetBatchSize(100)
                .build();
    }
}
