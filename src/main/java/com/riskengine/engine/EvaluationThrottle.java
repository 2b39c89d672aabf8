package com.riskengine.engine;

import com.riskengine.risk.RiskThresholds;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

/**
 * Rate limiter that bounds how often a full evaluation pass runs, however fast price
 * snapshots arrive.
 *
 * <p>The only state is the instant of the last admitted run. {@link #admit(Instant)} returns
 * true at most once per {@code minEvaluationInterval}; rejected ticks are dropped, never
 * queued. Admission is a compare-and-set, so two threads racing on the same window admit
 * exactly one pass.
 *
 * <p>State is process-local: a restart admits the first tick immediately.
 */
@Component
public class EvaluationThrottle {

    private final Clock clock;
    private final Duration minInterval;

    private final AtomicReference<Instant> lastRun = new AtomicReference<>();
    private final AtomicLong admitted = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    public EvaluationThrottle(Clock clock, RiskThresholds riskThresholds) {
        this.clock = clock;
        this.minInterval = riskThresholds.getMinEvaluationInterval();
    }

    public boolean admit() {
        return admit(clock.instant());
    }

    public boolean admit(Instant now) {
        Instant last = lastRun.get();
        if (last != null && Duration.between(last, now).compareTo(minInterval) < 0) {
            rejected.incrementAndGet();
            return false;
        }
        if (!lastRun.compareAndSet(last, now)) {
            rejected.incrementAndGet();
            return false;
        }
        admitted.incrementAndGet();
        return true;
    }

    /** Instant of the last admitted pass, or null before the first one. */
    public Instant getLastRun() {
        return lastRun.get();
    }

    public Duration getMinInterval() {
        return minInterval;
    }

    public long getAdmittedCount() {
        return admitted.get();
    }

    public long getRejectedCount() {
        return rejected.get();
    }
}
