package com.riskengine.config;

import com.riskengine.exception.ConfigurationException;
import com.riskengine.risk.RiskThresholds;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link RiskThresholds} bean from application.properties and the UTC
 * {@link Clock} every time-dependent component is built on.
 *
 * <p>Defaults match {@link RiskThresholds#defaults()}, so the engine runs with the
 * production rules when nothing is configured.
 *
 * <p>Properties prefix: {@code riskengine.*}
 */
@Configuration
public class RiskEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RiskThresholds riskThresholds(
            @Value("${riskengine.fee-rate:0.0007}") BigDecimal feeRate,
            @Value("${riskengine.margin.call-level:100}") BigDecimal marginCallLevel,
            @Value("${riskengine.margin.stop-out-level:50}") BigDecimal stopOutLevel,
            @Value("${riskengine.drawdown.max-pct:0.10}") BigDecimal maxDrawdownPct,
            @Value("${riskengine.drawdown.daily-pct:0.05}") BigDecimal dailyDrawdownPct,
            @Value("${riskengine.evaluation.min-interval:2s}") Duration minEvaluationInterval,
            @Value("${riskengine.price.stale-after:30s}") Duration priceStaleAfter,
            @Value("${riskengine.scan.max-open-positions:500}") int maxOpenPositionsPerScan,
            @Value("${riskengine.scan.max-pending-orders:1000}") int maxPendingOrdersPerScan,
            @Value("${riskengine.daily-reset.batch-size:100}") int dailyResetBatchSize) {
        RiskThresholds thresholds = RiskThresholds.builder()
                .feeRate(feeRate)
                .marginCallLevel(marginCallLevel)
                .stopOutLevel(stopOutLevel)
                .maxDrawdownPct(maxDrawdownPct)
                .dailyDrawdownPct(dailyDrawdownPct)
                .minEvaluationInterval(minEvaluationInterval)
                .priceStaleAfter(priceStaleAfter)
                .maxOpenPositionsPerScan(maxOpenPositionsPerScan)
                .maxPendingOrdersPerScan(maxPendingOrdersPerScan)
                .dailyResetBatchSize(dailyResetBatchSize)
                .build();
        validate(thresholds);
        return thresholds;
    }

    public static void validate(RiskThresholds thresholds) {
        if (thresholds.getStopOutLevel().compareTo(thresholds.getMarginCallLevel()) > 0) {
            throw new ConfigurationException(
                    "Stop-out level must not exceed the margin-call level",
                    Map.of(
                            "stopOutLevel", thresholds.getStopOutLevel(),
                            "marginCallLevel", thresholds.getMarginCallLevel()));
        }
        if (thresholds.getFeeRate().signum() < 0) {
            throw new ConfigurationException("Fee rate must not be negative", Map.of("feeRate", thresholds.getFeeRate()));
        }
        if (!isFraction(thresholds.getMaxDrawdownPct()) || !isFraction(thresholds.getDailyDrawdownPct())) {
            throw new ConfigurationException(
                    "Drawdown limits are fractions between 0 and 1",
                    Map.of(
                            "maxDrawdownPct", thresholds.getMaxDrawdownPct(),
                            "dailyDrawdownPct", thresholds.getDailyDrawdownPct()));
        }
        if (thresholds.getMinEvaluationInterval().isNegative()) {
            throw new ConfigurationException(
                    "Evaluation interval must not be negative",
                    Map.of("minEvaluationInterval", thresholds.getMinEvaluationInterval()));
        }
    }

    private static boolean isFraction(BigDecimal value) {
        return value.signum() > 0 && value.compareTo(BigDecimal.ONE) < 0;
    }
}
