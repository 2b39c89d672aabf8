package com.riskengine.observability;

import com.riskengine.domain.enums.CloseReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the risk engine's custom Micrometer metrics.
 *
 * <ul>
 *   <li><b>riskengine.positions.closed</b> (counter, tag {@code reason}): settled closes</li>
 *   <li><b>riskengine.margin.calls</b> (counter): margin-call notifications raised</li>
 *   <li><b>riskengine.stop.outs</b> (counter): stop-out liquidations</li>
 *   <li><b>riskengine.breaches</b> (counter): accounts moved to BREACHED</li>
 *   <li><b>riskengine.ticks</b> (counter, tag {@code outcome}): admitted / throttled / failed</li>
 *   <li><b>riskengine.evaluation</b> (timer): duration of an admitted pass</li>
 * </ul>
 */
@Service
public class RiskMetricsService {

    private final Map<CloseReason, Counter> closedCounters = new EnumMap<>(CloseReason.class);
    private final Counter marginCallCounter;
    private final Counter stopOutCounter;
    private final Counter breachCounter;
    private final Counter admittedTickCounter;
    private final Counter throttledTickCounter;
    private final Counter failedTickCounter;
    private final Timer evaluationTimer;

    public RiskMetricsService(MeterRegistry meterRegistry) {
        for (CloseReason reason : CloseReason.values()) {
            closedCounters.put(
                    reason,
                    Counter.builder("riskengine.positions.closed")
                            .description("Positions settled by the risk engine")
                            .tag("reason", reason.name().toLowerCase())
                            .register(meterRegistry));
        }

        this.marginCallCounter = Counter.builder("riskengine.margin.calls")
                .description("Margin-call notifications raised")
                .register(meterRegistry);

        this.stopOutCounter = Counter.builder("riskengine.stop.outs")
                .description("Worst-position liquidations on stop-out")
                .register(meterRegistry);

        this.breachCounter = Counter.builder("riskengine.breaches")
                .description("Accounts breached on drawdown")
                .register(meterRegistry);

        this.admittedTickCounter = tickCounter(meterRegistry, "admitted");
        this.throttledTickCounter = tickCounter(meterRegistry, "throttled");
        this.failedTickCounter = tickCounter(meterRegistry, "failed");

        this.evaluationTimer = Timer.builder("riskengine.evaluation")
                .description("Duration of an admitted evaluation pass")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(5))
                .register(meterRegistry);
    }

    private static Counter tickCounter(MeterRegistry meterRegistry, String outcome) {
        return Counter.builder("riskengine.ticks")
                .description("Price snapshots received by the risk engine")
                .tag("outcome", outcome)
                .register(meterRegistry);
    }

    public void recordClose(CloseReason reason) {
        closedCounters.get(reason).increment();
    }

    public void recordMarginCall() {
        marginCallCounter.increment();
    }

    public void recordStopOut() {
        stopOutCounter.increment();
    }

    public void recordBreach() {
        breachCounter.increment();
    }

    public void recordAdmittedTick() {
        admittedTickCounter.increment();
    }

    public void recordThrottledTick() {
        throttledTickCounter.increment();
    }

    public void recordFailedTick() {
        failedTickCounter.increment();
    }

    public Timer getEvaluationTimer() {
        return evaluationTimer;
    }
}
