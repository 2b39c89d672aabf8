package com.riskengine.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.riskengine.domain.vo.Decimals;
import com.riskengine.domain.vo.Money;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MoneyTest {

    @Test
    @DisplayName("Dollar formatting rounds half up to cents")
    void dollars() {
        assertThat(Money.usd(new BigDecimal("65990")).toDollars()).isEqualTo("$65990.00");
        assertThat(Money.usd(new BigDecimal("9801.39407")).toDollars()).isEqualTo("$9801.39");
        assertThat(Money.usd(new BigDecimal("0.005")).toDollars()).isEqualTo("$0.01");
    }

    @Test
    @DisplayName("Signed formatting puts the sign before the dollar sign")
    void signedDollars() {
        assertThat(Money.usd(new BigDecimal("-198.1440")).toSignedDollars()).isEqualTo("-$198.14");
        assertThat(Money.usd(new BigDecimal("12.5")).toSignedDollars()).isEqualTo("+$12.50");
        assertThat(Money.zero().toSignedDollars()).isEqualTo("+$0.00");
    }

    @Test
    @DisplayName("Arithmetic is exact")
    void arithmetic() {
        Money total = Money.usd(new BigDecimal("0.1")).add(Money.usd(new BigDecimal("0.2")));

        assertThat(total.getAmount()).isEqualByComparingTo("0.3");
        assertThat(total.subtract(Money.usd(BigDecimal.ONE)).isNegative()).isTrue();
        assertThat(total.negate().getAmount()).isEqualByComparingTo("-0.3");
    }

    @Test
    @DisplayName("Percent conversion keeps two decimals")
    void percent() {
        assertThat(Decimals.toPercent(new BigDecimal("0.12345"))).isEqualByComparingTo("12.35");
        assertThat(Decimals.toPercent(Decimals.divide(BigDecimal.ONE, new BigDecimal("3"))).toPlainString())
                .isEqualTo("33.33");
    }

    @Test
    @DisplayName("Null columns read as zero")
    void orZero() {
        assertThat(Decimals.orZero(null)).isEqualByComparingTo("0");
        assertThat(Decimals.isPositive(null)).isFalse();
        assertThat(Decimals.max(new BigDecimal("-1"), BigDecimal.ZERO)).isEqualByComparingTo("0");
    }
}
