package com.riskengine.domain.vo;

import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.Value;

/**
 * Immutable USD amount. Used where a monetary value is rendered for people
 * (activity feed, breach reasons, logs); arithmetic stays on {@link BigDecimal}.
 */
@Value
public class Money {

    public static final String USD = "USD";

    BigDecimal amount;
    String currency;

    public static Money usd(BigDecimal amount) {
        return new Money(Decimals.orZero(amount), USD);
    }

    public static Money zero() {
        return new Money(BigDecimal.ZERO, USD);
    }

    public Money add(Money other) {
        return new Money(amount.add(other.amount), currency);
    }

    public Money subtract(Money other) {
        return new Money(amount.subtract(other.amount), currency);
    }

    public Money negate() {
        return new Money(amount.negate(), currency);
    }

    public boolean isNegative() {
        return amount.signum() < 0;
    }

    /** {@code $1234.50}; negative amounts keep their sign: {@code $-12.00}. */
    public String toDollars() {
        return "$" + amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    /** {@code +$12.34} or {@code -$12.34}, as shown for realized P&L. */
    public String toSignedDollars() {
        String abs = amount.abs().setScale(2, RoundingMode.HALF_UP).toPlainString();
        return (isNegative() ? "-$" : "+$") + abs;
    }
}
