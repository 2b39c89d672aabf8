package com.riskengine.domain.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Normalized top-of-book quote for one symbol, as delivered by the price stream.
 * Never persisted by the engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceTick {

    private BigDecimal bid;
    private BigDecimal ask;
    private BigDecimal last;

    /** When the quote was taken. Null means the feed did not stamp it; treated as fresh. */
    private Instant timestamp;

    public static PriceTick of(String bid, String ask, String last) {
        return new PriceTick(new BigDecimal(bid), new BigDecimal(ask), new BigDecimal(last), null);
    }

    public boolean isStale(Instant now, Duration maxAge) {
        return timestamp != null && Duration.between(timestamp, now).compareTo(maxAge) > 0;
    }
}
