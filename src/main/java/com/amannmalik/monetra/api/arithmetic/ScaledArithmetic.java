package com.amannmalik.monetra.api.arithmetic;

import com.amannmalik.monetra.api.literal.DecimalLiterals;
import com.amannmalik.monetra.api.result.MonetaryError;
import com.amannmalik.monetra.api.result.Outcome;
import com.amannmalik.monetra.api.rounding.RoundingEngine;
import com.amannmalik.monetra.api.rounding.RoundingPolicy;
import com.amannmalik.monetra.api.shared.MinorUnitAmount;
import com.amannmalik.monetra.api.shared.Ratio;
import com.amannmalik.monetra.util.Ensure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * Multiplication and division of minor-unit amounts by exact {@link Ratio}s.
 *
 * <p>An exact result is always returned as is. An inexact one is only rounded when the caller
 * names a {@link RoundingPolicy}; a {@code null} policy means "none given" and yields
 * {@link MonetaryError.RoundingRequired}.
 */
public final class ScaledArithmetic {
    private static final Logger LOG = LoggerFactory.getLogger(ScaledArithmetic.class);

    private ScaledArithmetic() {
    }

    public static Outcome<MinorUnitAmount> multiply(MinorUnitAmount amount, Ratio multiplier) {
        return multiply(amount, multiplier, null);
    }

    /// {@code amount * numerator / denominator}.
    public static Outcome<MinorUnitAmount> multiply(MinorUnitAmount amount, Ratio multiplier, RoundingPolicy policy) {
        Ensure.notNull("amount", amount);
        Ensure.notNull("multiplier", multiplier);
        var product = amount.value().multiply(multiplier.numerator());
        return quotient("multiply", product, multiplier.denominator(), policy);
    }

    public static Outcome<MinorUnitAmount> multiply(MinorUnitAmount amount, String multiplier, RoundingPolicy policy) {
        return DecimalLiterals.parseRatio(multiplier).flatMap(ratio -> multiply(amount, ratio, policy));
    }

    public static Outcome<MinorUnitAmount> divide(MinorUnitAmount amount, Ratio divisor) {
        return divide(amount, divisor, null);
    }

    /// {@code amount * denominator / numerator}; a zero divisor fails before any rounding.
    public static Outcome<MinorUnitAmount> divide(MinorUnitAmount amount, Ratio divisor, RoundingPolicy policy) {
        Ensure.notNull("amount", amount);
        Ensure.notNull("divisor", divisor);
        if (divisor.isZero()) {
            return Outcome.failure(new MonetaryError.DivisionByZero("divide"));
        }
        var product = amount.value().multiply(divisor.denominator());
        return quotient("divide", product, divisor.numerator(), policy);
    }

    public static Outcome<MinorUnitAmount> divide(MinorUnitAmount amount, String divisor, RoundingPolicy policy) {
        return DecimalLiterals.parseRatio(divisor).flatMap(ratio -> divide(amount, ratio, policy));
    }

    private static Outcome<MinorUnitAmount> quotient(
            String operation, BigInteger product, BigInteger divisor, RoundingPolicy policy) {
        var qr = product.divideAndRemainder(divisor);
        if (qr[1].signum() == 0) {
            return Outcome.success(new MinorUnitAmount(qr[0]));
        }
        if (policy == null) {
            return Outcome.failure(new MonetaryError.RoundingRequired(operation, product, divisor));
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("Rounding inexact {} result {}/{} with {}", operation, product, divisor, policy);
        }
        return RoundingEngine.roundedDivide(product, divisor, policy).map(MinorUnitAmount::new);
    }
}
