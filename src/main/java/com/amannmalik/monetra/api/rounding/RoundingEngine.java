package com.amannmalik.monetra.api.rounding;

import com.amannmalik.monetra.api.result.MonetaryError;
import com.amannmalik.monetra.api.result.Outcome;
import com.amannmalik.monetra.util.Ensure;

import java.math.BigInteger;

/**
 * Integer division with an explicit rounding policy.
 *
 * <p>The quotient is computed by truncating division and then adjusted by at most one unit.
 * Exact quotients are returned untouched whatever the policy.
 */
public final class RoundingEngine {
    private RoundingEngine() {
    }

    /**
     * Divides {@code numerator} by {@code denominator}, rounding the exact quotient to an
     * integer as {@code policy} prescribes.
     *
     * @return the rounded quotient, {@link MonetaryError.DivisionByZero} when the denominator
     *         is zero, or {@link MonetaryError.UnsupportedPolicy} when no policy is given
     */
    public static Outcome<BigInteger> roundedDivide(BigInteger numerator, BigInteger denominator, RoundingPolicy policy) {
        Ensure.notNull("numerator", numerator);
        Ensure.notNull("denominator", denominator);
        if (denominator.signum() == 0) {
            return Outcome.failure(new MonetaryError.DivisionByZero("roundedDivide"));
        }
        var qr = numerator.divideAndRemainder(denominator);
        var quotient = qr[0];
        var remainder = qr[1];
        if (remainder.signum() == 0) {
            return Outcome.success(quotient);
        }
        if (policy == null) {
            return Outcome.failure(new MonetaryError.UnsupportedPolicy(null));
        }
        var positive = numerator.signum() == denominator.signum();
        var half = remainder.abs().shiftLeft(1).compareTo(denominator.abs());
        var awayFromZero = positive ? quotient.add(BigInteger.ONE) : quotient.subtract(BigInteger.ONE);
        var rounded = switch (policy) {
            case FLOOR -> positive ? quotient : awayFromZero;
            case CEIL -> positive ? awayFromZero : quotient;
            case TRUNCATE -> quotient;
            case HALF_UP -> half >= 0 ? awayFromZero : quotient;
            case HALF_DOWN -> half > 0 ? awayFromZero : quotient;
            case HALF_EVEN -> half > 0 || (half == 0 && quotient.testBit(0)) ? awayFromZero : quotient;
        };
        return Outcome.success(rounded);
    }

    public static Outcome<BigInteger> roundedDivide(long numerator, long denominator, RoundingPolicy policy) {
        return roundedDivide(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator), policy);
    }
}
