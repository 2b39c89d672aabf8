package com.riskengine.unit.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.riskengine.config.RiskEngineConfig;
import com.riskengine.exception.ConfigurationException;
import com.riskengine.exception.ErrorCode;
import com.riskengine.risk.RiskThresholds;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RiskEngineConfigTest {

    private final RiskEngineConfig config = new RiskEngineConfig();

    @Test
    @DisplayName("Builds thresholds from properties")
    void buildsThresholds() {
        RiskThresholds thresholds = config.riskThresholds(
                new BigDecimal("0.001"),
                new BigDecimal("120"),
                new BigDecimal("40"),
                new BigDecimal("0.08"),
                new BigDecimal("0.04"),
                Duration.ofSeconds(5),
                Duration.ofSeconds(10),
                50,
                60,
                70);

        assertThat(thresholds.getFeeRate()).isEqualByComparingTo("0.001");
        assertThat(thresholds.getMarginCallLevel()).isEqualByComparingTo("120");
        assertThat(thresholds.getStopOutLevel()).isEqualByComparingTo("40");
        assertThat(thresholds.getMinEvaluationInterval()).isEqualTo(Duration.ofSeconds(5));
        assertThat(thresholds.getPriceStaleAfter()).isEqualTo(Duration.ofSeconds(10));
        assertThat(thresholds.getDailyResetBatchSize()).isEqualTo(70);
    }

    @Test
    @DisplayName("Clock is UTC")
    void utcClock() {
        Clock clock = config.clock();

        assertThat(clock.getZone()).isEqualTo(ZoneOffset.UTC);
    }

    @Test
    @DisplayName("Defaults are valid")
    void defaultsValid() {
        assertThatCode(() -> RiskEngineConfig.validate(RiskThresholds.defaults())).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Stop-out above margin call is rejected")
    void stopOutAboveMarginCall() {
        RiskThresholds thresholds =
                RiskThresholds.defaults().toBuilder().stopOutLevel(new BigDecimal("150")).build();

        assertThatThrownBy(() -> RiskEngineConfig.validate(thresholds))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Stop-out")
                .extracting(e -> ((ConfigurationException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_CONFIGURATION);
    }

    @Test
    @DisplayName("Drawdown limits must be fractions")
    void drawdownAsPercentRejected() {
        RiskThresholds thresholds =
                RiskThresholds.defaults().toBuilder().maxDrawdownPct(new BigDecimal("10")).build();

        assertThatThrownBy(() -> RiskEngineConfig.validate(thresholds)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Negative fee rate is rejected")
    void negativeFee() {
        RiskThresholds thresholds =
                RiskThresholds.defaults().toBuilder().feeRate(new BigDecimal("-0.0001")).build();

        assertThatThrownBy(() -> RiskEngineConfig.validate(thresholds)).isInstanceOf(ConfigurationException.class);
    }
}
