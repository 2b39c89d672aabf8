package com.riskengine.unit.margin;

import static com.riskengine.support.RiskFixtures.ACCOUNT_ID;
import static com.riskengine.support.RiskFixtures.account;
import static com.riskengine.support.RiskFixtures.position;
import static com.riskengine.support.RiskFixtures.quote;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.riskengine.domain.enums.CloseReason;
import com.riskengine.domain.enums.PositionDirection;
import com.riskengine.domain.model.Account;
import com.riskengine.domain.model.CloseResult;
import com.riskengine.domain.model.Position;
import com.riskengine.domain.model.PriceTick;
import com.riskengine.engine.PositionCloser;
import com.riskengine.event.RiskEvent;
import com.riskengine.event.RiskEventType;
import com.riskengine.event.RiskLevel;
import com.riskengine.margin.MarginCheckResult;
import com.riskengine.margin.MarginMonitorService;
import com.riskengine.observability.RiskMetricsService;
import com.riskengine.pnl.AccountExposure;
import com.riskengine.pnl.PositionExposure;
import com.riskengine.pnl.PositionPnLCalculator;
import com.riskengine.risk.RiskThresholds;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Unit tests for MarginMonitorService covering margin-level math, threshold detection,
 * margin-call deduplication and stop-out selection.
 */
@ExtendWith(MockitoExtension.class)
class MarginMonitorServiceTest {

    @Mock
    private PositionCloser positionCloser;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private final PositionPnLCalculator pnlCalculator = new PositionPnLCalculator(RiskThresholds.defaults());
    private SimpleMeterRegistry meterRegistry;
    private MarginMonitorService marginMonitorService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        marginMonitorService = new MarginMonitorService(
                positionCloser, RiskThresholds.defaults(), new RiskMetricsService(meterRegistry), applicationEventPublisher);
    }

    /** Account with no priced positions: equity equals net worth. */
    private AccountExposure flatExposure(String netWorth, String totalMarginRequired) {
        Account account = account(ACCOUNT_ID)
                .netWorth(new BigDecimal(netWorth))
                .totalMarginRequired(new BigDecimal(totalMarginRequired))
                .build();
        return pnlCalculator.exposure(account, List.of(), Map.of());
    }

    private static CloseResult liquidated(String positionId) {
        return CloseResult.builder()
                .positionId(positionId)
                .closed(true)
                .closeReason(CloseReason.LIQUIDATION)
                .build();
    }

    private Position longAt(String id, String symbol, String entry) {
        return position(id, symbol, PositionDirection.LONG, "1", 1, entry).build();
    }

    // ==============================
    // MARGIN LEVEL
    // ==============================

    @Nested
    @DisplayName("Margin Level")
    class MarginLevel {

        @Test
        @DisplayName("Level is equity over margin required, in percent")
        void levelMath() {
            assertThat(MarginMonitorService.marginLevel(new BigDecimal("750"), new BigDecimal("1000")))
                    .isEqualByComparingTo("75");
            assertThat(MarginMonitorService.marginLevel(new BigDecimal("1"), new BigDecimal("3")))
                    .isGreaterThan(new BigDecimal("33.3333"))
                    .isLessThan(new BigDecimal("33.3334"));
        }

        @Test
        @DisplayName("Equity includes unrealized P&L of priced positions")
        void equityIncludesUnrealized() {
            Account account = account(ACCOUNT_ID)
                    .netWorth(new BigDecimal("1000"))
                    .totalMarginRequired(new BigDecimal("1000"))
                    .build();
            AccountExposure exposure = pnlCalculator.exposure(
                    account,
                    List.of(longAt("p1", "SOL-USD", "100")),
                    Map.of("SOL-USD", quote("150", "151")));

            MarginCheckResult result = marginMonitorService.check(exposure);

            assertThat(exposure.getEquity()).isEqualByComparingTo("1050");
            assertThat(result.getMarginLevel()).isEqualByComparingTo("105");
            assertThat(result.getState()).isEqualTo(MarginCheckResult.State.HEALTHY);
        }

        @Test
        @DisplayName("No margin in use is not applicable")
        void zeroMarginRequired() {
            MarginCheckResult result = marginMonitorService.check(flatExposure("-500", "0"));

            assertThat(result.getState()).isEqualTo(MarginCheckResult.State.NOT_APPLICABLE);
            assertThat(result.getMarginLevel()).isNull();
            verify(applicationEventPublisher, never()).publishEvent(any());
        }
    }

    // ==============================
    // MARGIN CALL
    // ==============================

    @Nested
    @DisplayName("Margin Call")
    class MarginCall {

        @Test
        @DisplayName("Exactly 100% raises a WARNING margin call")
        void exactlyAtCallLevel() {
            MarginCheckResult result = marginMonitorService.check(flatExposure("1000", "1000"));

            assertThat(result.getState()).isEqualTo(MarginCheckResult.State.MARGIN_CALL);
            ArgumentCaptor<RiskEvent> captor = ArgumentCaptor.forClass(RiskEvent.class);
            verify(applicationEventPublisher).publishEvent(captor.capture());
            assertThat(captor.getValue().getEventType()).isEqualTo(RiskEventType.MARGIN_CALL);
            assertThat(captor.getValue().getLevel()).isEqualTo(RiskLevel.WARNING);
            assertThat(captor.getValue().getMessage()).contains("100.00%");
            verify(positionCloser, never()).close(any(), any(), any());
        }

        @Test
        @DisplayName("Margin call fires once while the level stays low")
        void deduplicated() {
            marginMonitorService.check(flatExposure("800", "1000"));
            marginMonitorService.check(flatExposure("700", "1000"));

            verify(applicationEventPublisher, times(1)).publishEvent(any(RiskEvent.class));
            assertThat(meterRegistry.get("riskengine.margin.calls").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Recovery re-arms the margin call")
        void rearmedAfterRecovery() {
            marginMonitorService.check(flatExposure("800", "1000"));
            marginMonitorService.check(flatExposure("2000", "1000"));
            marginMonitorService.check(flatExposure("900", "1000"));

            verify(applicationEventPublisher, times(2)).publishEvent(any(RiskEvent.class));
        }

        @Test
        @DisplayName("A stop-out re-arms the margin call")
        void rearmedAfterStopOut() {
            marginMonitorService.check(flatExposure("800", "1000"));
            marginMonitorService.check(flatExposure("300", "1000"));
            marginMonitorService.check(flatExposure("800", "1000"));

            assertThat(meterRegistry.get("riskengine.margin.calls").counter().count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Forgetting a breached account re-arms the margin call")
        void rearmedAfterForget() {
            marginMonitorService.check(flatExposure("800", "1000"));
            marginMonitorService.forget(ACCOUNT_ID);
            marginMonitorService.check(flatExposure("800", "1000"));

            verify(applicationEventPublisher, times(2)).publishEvent(any(RiskEvent.class));
        }

        @Test
        @DisplayName("Above the call level is healthy")
        void healthy() {
            MarginCheckResult result = marginMonitorService.check(flatExposure("1000.01", "1000"));

            assertThat(result.getState()).isEqualTo(MarginCheckResult.State.HEALTHY);
            verify(applicationEventPublisher, never()).publishEvent(any());
        }
    }

    // ==============================
    // STOP OUT
    // ==============================

    @Nested
    @DisplayName("Stop Out")
    class StopOut {

        @Test
        @DisplayName("Closes the -120 position out of (-50, -10, -120)")
        void closesWorstPosition() {
            Position p1 = longAt("p1", "AAA", "100");
            Position p2 = longAt("p2", "BBB", "100");
            Position p3 = longAt("p3", "CCC", "200");
            Map<String, PriceTick> prices = Map.of(
                    "AAA", quote("50", "51"),
                    "BBB", quote("90", "91"),
                    "CCC", quote("80", "81"));
            Account account = account(ACCOUNT_ID)
                    .netWorth(new BigDecimal("400"))
                    .totalMarginRequired(new BigDecimal("1000"))
                    .build();
            AccountExposure exposure = pnlCalculator.exposure(account, List.of(p1, p2, p3), prices);
            when(positionCloser.close(p3, new BigDecimal("80"), CloseReason.LIQUIDATION)).thenReturn(liquidated("p3"));

            MarginCheckResult result = marginMonitorService.check(exposure);

            // equity 400 - 180 = 220 -> 22%
            assertThat(result.getMarginLevel()).isEqualByComparingTo("22");
            assertThat(result.isStopOut()).isTrue();
            verify(positionCloser).close(p3, new BigDecimal("80"), CloseReason.LIQUIDATION);
            verify(positionCloser, times(1)).close(any(), any(), any());

            ArgumentCaptor<RiskEvent> captor = ArgumentCaptor.forClass(RiskEvent.class);
            verify(applicationEventPublisher).publishEvent(captor.capture());
            assertThat(captor.getValue().getEventType()).isEqualTo(RiskEventType.STOP_OUT);
            assertThat(captor.getValue().getLevel()).isEqualTo(RiskLevel.CRITICAL);
            assertThat(captor.getValue().getDetails()).containsEntry("positionId", "p3");
            assertThat(meterRegistry.get("riskengine.stop.outs").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Exactly 50% is a stop-out")
        void exactlyAtStopOut() {
            Position p1 = longAt("p1", "AAA", "100");
            Account account = account(ACCOUNT_ID)
                    .netWorth(new BigDecimal("510"))
                    .totalMarginRequired(new BigDecimal("1000"))
                    .build();
            AccountExposure exposure =
                    pnlCalculator.exposure(account, List.of(p1), Map.of("AAA", quote("90", "91")));
            when(positionCloser.close(p1, new BigDecimal("90"), CloseReason.LIQUIDATION)).thenReturn(liquidated("p1"));

            assertThat(marginMonitorService.check(exposure).isStopOut()).isTrue();
            verify(positionCloser).close(p1, new BigDecimal("90"), CloseReason.LIQUIDATION);
        }

        @Test
        @DisplayName("Unpriced worst position ranks at zero and is not closed")
        void unpricedWorst() {
            Position unpriced = longAt("p1", "NOQUOTE", "100");
            Position winner = longAt("p2", "BBB", "100");
            Account account = account(ACCOUNT_ID)
                    .netWorth(new BigDecimal("300"))
                    .totalMarginRequired(new BigDecimal("1000"))
                    .build();
            AccountExposure exposure = pnlCalculator.exposure(
                    account, List.of(unpriced, winner), Map.of("BBB", quote("110", "111")));

            MarginCheckResult result = marginMonitorService.check(exposure);

            assertThat(result.isStopOut()).isTrue();
            verify(positionCloser, never()).close(any(), any(), any());
            verify(applicationEventPublisher, never()).publishEvent(any());
        }

        @Test
        @DisplayName("A skipped liquidation is neither counted nor announced")
        void skippedCloseNotReported() {
            Position p1 = longAt("p1", "AAA", "100");
            Account account = account(ACCOUNT_ID)
                    .netWorth(new BigDecimal("319"))
                    .totalMarginRequired(new BigDecimal("1000"))
                    .build();
            AccountExposure exposure =
                    pnlCalculator.exposure(account, List.of(p1), Map.of("AAA", quote("70", "71")));
            when(positionCloser.close(p1, new BigDecimal("70"), CloseReason.LIQUIDATION))
                    .thenReturn(CloseResult.skipped("p1", "position not open"));

            MarginCheckResult result = marginMonitorService.check(exposure);

            // equity 319 - 30 = 289 -> 28.9%
            assertThat(result.isStopOut()).isTrue();
            assertThat(meterRegistry.get("riskengine.stop.outs").counter().count()).isEqualTo(0.0);
            verify(applicationEventPublisher, never()).publishEvent(any());
        }

        @Test
        @DisplayName("Ties keep fetch order")
        void stableRanking() {
            Position first = longAt("first", "AAA", "100");
            Position second = longAt("second", "BBB", "100");
            List<PositionExposure> ranked = List.of(
                    new PositionExposure(first, new BigDecimal("50"), new BigDecimal("-50")),
                    new PositionExposure(second, new BigDecimal("50"), new BigDecimal("-50")));

            assertThat(MarginMonitorService.worstPosition(ranked).getPosition().getId()).isEqualTo("first");
        }
    }
}
