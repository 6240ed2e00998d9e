package com.amannmalik.monetra.api.arithmetic.tests;

import com.amannmalik.monetra.api.arithmetic.ScaledArithmetic;
import com.amannmalik.monetra.api.result.MonetaryError;
import com.amannmalik.monetra.api.result.MonetaryErrorCode;
import com.amannmalik.monetra.api.rounding.RoundingPolicy;
import com.amannmalik.monetra.api.shared.MinorUnitAmount;
import com.amannmalik.monetra.api.shared.Ratio;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

final class ScaledArithmeticTest {
    private static final MinorUnitAmount ONE_DOLLAR = MinorUnitAmount.of(100);

    @Test
    void inexactMultiplyWithoutPolicyRequiresRounding() {
        var outcome = ScaledArithmetic.multiply(ONE_DOLLAR, "0.555", null);
        var error = assertInstanceOf(MonetaryError.RoundingRequired.class, outcome.error().orElseThrow());
        assertEquals("multiply", error.operation());
        assertEquals(BigInteger.valueOf(55_500), error.numerator());
        assertEquals(BigInteger.valueOf(1_000), error.denominator());
        assertEquals(0, new BigDecimal("55.5").compareTo(error.approximateResult()));
        assertEquals(MonetaryErrorCode.ROUNDING_REQUIRED, error.code());
        assertTrue(error.message().contains("multiply"));
    }

    @ParameterizedTest
    @CsvSource({
            "HALF_UP, 56",
            "HALF_DOWN, 55",
            "HALF_EVEN, 56",
            "FLOOR, 55",
            "CEIL, 56",
            "TRUNCATE, 55"
    })
    void inexactMultiplyIsRoundedByThePolicy(RoundingPolicy policy, long expected) {
        assertEquals(MinorUnitAmount.of(expected), ScaledArithmetic.multiply(ONE_DOLLAR, "0.555", policy).orElseThrow());
    }

    @Test
    void negativeProductsRoundAwayFromZeroOnHalfUp() {
        var result = ScaledArithmetic.multiply(MinorUnitAmount.of(-100), "0.555", RoundingPolicy.HALF_UP);
        assertEquals(MinorUnitAmount.of(-56), result.orElseThrow());
    }

    @Test
    void exactMultiplyNeedsNoPolicy() {
        assertEquals(MinorUnitAmount.of(150), ScaledArithmetic.multiply(ONE_DOLLAR, Ratio.of(15, 10)).orElseThrow());
        assertEquals(MinorUnitAmount.of(-300), ScaledArithmetic.multiply(ONE_DOLLAR, Ratio.of(-3)).orElseThrow());
        assertEquals(MinorUnitAmount.zero(), ScaledArithmetic.multiply(ONE_DOLLAR, Ratio.of(0)).orElseThrow());
    }

    @Test
    void fractionalFactorsStayExactAcrossChainedOperations() {
        var start = MinorUnitAmount.of(1_000);
        var factor = Ratio.of(new BigDecimal("1.5"));
        var there = ScaledArithmetic.multiply(start, factor).orElseThrow();
        var back = ScaledArithmetic.divide(there, factor).orElseThrow();
        assertEquals(MinorUnitAmount.of(1_500), there);
        assertEquals(start, back);
    }

    @Test
    void inexactDivideWithoutPolicyRequiresRounding() {
        var error = ScaledArithmetic.divide(ONE_DOLLAR, Ratio.of(3)).error().orElseThrow();
        assertEquals(new MonetaryError.RoundingRequired("divide", BigInteger.valueOf(100), BigInteger.valueOf(3)), error);
    }

    @Test
    void divideRoundsWithPolicy() {
        assertEquals(MinorUnitAmount.of(33), ScaledArithmetic.divide(ONE_DOLLAR, Ratio.of(3), RoundingPolicy.HALF_UP).orElseThrow());
        assertEquals(MinorUnitAmount.of(34), ScaledArithmetic.divide(ONE_DOLLAR, Ratio.of(3), RoundingPolicy.CEIL).orElseThrow());
    }

    @Test
    void divideByFractionMultipliesByItsReciprocal() {
        assertEquals(MinorUnitAmount.of(200), ScaledArithmetic.divide(ONE_DOLLAR, "0.5", null).orElseThrow());
        assertEquals(MinorUnitAmount.of(-25), ScaledArithmetic.divide(ONE_DOLLAR, "-4", null).orElseThrow());
    }

    @ParameterizedTest
    @EnumSource(RoundingPolicy.class)
    void zeroDivisorFailsWhateverThePolicy(RoundingPolicy policy) {
        var error = ScaledArithmetic.divide(ONE_DOLLAR, "0.00", policy).error().orElseThrow();
        assertEquals(new MonetaryError.DivisionByZero("divide"), error);
    }

    @Test
    void zeroDivisorFailsWithoutPolicy() {
        assertEquals(MonetaryErrorCode.DIVISION_BY_ZERO, ScaledArithmetic.divide(ONE_DOLLAR, Ratio.of(0)).error().orElseThrow().code());
    }

    @Test
    void malformedFactorIsFormatError() {
        var error = ScaledArithmetic.multiply(ONE_DOLLAR, "1e2", RoundingPolicy.HALF_UP).error().orElseThrow();
        assertEquals(MonetaryErrorCode.FORMAT, error.code());
    }

    @Test
    void intermediateProductsMayExceedLongRange() {
        var amount = MinorUnitAmount.of(Long.MAX_VALUE);
        var doubled = ScaledArithmetic.multiply(amount, Ratio.of(2)).orElseThrow();
        assertEquals(BigInteger.valueOf(Long.MAX_VALUE).shiftLeft(1), doubled.value());
        assertEquals(amount, ScaledArithmetic.divide(doubled, Ratio.of(2)).orElseThrow());
    }
}
