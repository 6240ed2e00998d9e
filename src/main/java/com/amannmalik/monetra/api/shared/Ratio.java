package com.amannmalik.monetra.api.shared;

import com.amannmalik.monetra.util.Ensure;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

/**
 * Exact rational scalar used as a multiplier, divisor or allocation weight.
 *
 * <p>Ratios are never reduced: a ratio parsed from {@code "1.50"} keeps {@code 150/100}. The
 * denominator is always positive, so the sign lives in the numerator.
 */
public record Ratio(BigInteger numerator, BigInteger denominator) {
    public static final Ratio ONE = new Ratio(BigInteger.ONE, BigInteger.ONE);

    public Ratio {
        numerator = Ensure.notNull("ratio.numerator", numerator);
        denominator = Ensure.positive("ratio.denominator", denominator);
    }

    public static Ratio of(long value) {
        return new Ratio(BigInteger.valueOf(value), BigInteger.ONE);
    }

    public static Ratio of(long numerator, long denominator) {
        return new Ratio(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    /// Exact conversion: {@code unscaledValue / 10^scale}. Negative scales become integers.
    public static Ratio of(BigDecimal value) {
        Ensure.notNull("ratio", value);
        if (value.scale() <= 0) {
            return new Ratio(value.toBigIntegerExact(), BigInteger.ONE);
        }
        return new Ratio(value.unscaledValue(), BigInteger.TEN.pow(value.scale()));
    }

    public boolean isZero() {
        return numerator.signum() == 0;
    }

    public int signum() {
        return numerator.signum();
    }

    public Ratio dividedBy(BigInteger divisor) {
        Ensure.positive("divisor", divisor);
        return new Ratio(numerator, denominator.multiply(divisor));
    }

    public BigDecimal toBigDecimal() {
        return new BigDecimal(numerator).divide(new BigDecimal(denominator), MathContext.DECIMAL128);
    }

    @Override
    public String toString() {
        return numerator + "/" + denominator;
    }
}
