package com.amannmalik.monetra.api.shared;

import com.amannmalik.monetra.util.Ensure;

import java.math.BigInteger;

/// A signed amount in a currency's smallest unit. Unbounded; fractional information is
/// already folded in by the currency's decimal count.
public record MinorUnitAmount(BigInteger value) implements Comparable<MinorUnitAmount> {
    private static final MinorUnitAmount ZERO = new MinorUnitAmount(BigInteger.ZERO);

    public MinorUnitAmount {
        value = Ensure.notNull("amount", value);
    }

    public static MinorUnitAmount zero() {
        return ZERO;
    }

    public static MinorUnitAmount of(long value) {
        return new MinorUnitAmount(BigInteger.valueOf(value));
    }

    public MinorUnitAmount plus(MinorUnitAmount other) {
        return new MinorUnitAmount(value.add(other.value));
    }

    public MinorUnitAmount minus(MinorUnitAmount other) {
        return new MinorUnitAmount(value.subtract(other.value));
    }

    public MinorUnitAmount negate() {
        return new MinorUnitAmount(value.negate());
    }

    public int signum() {
        return value.signum();
    }

    @Override
    public int compareTo(MinorUnitAmount other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
