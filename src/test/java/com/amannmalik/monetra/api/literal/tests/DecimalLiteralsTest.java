package com.amannmalik.monetra.api.literal.tests;

import com.amannmalik.monetra.api.literal.DecimalLiterals;
import com.amannmalik.monetra.api.result.MonetaryError;
import com.amannmalik.monetra.api.result.MonetaryErrorCode;
import com.amannmalik.monetra.api.shared.MinorUnitAmount;
import com.amannmalik.monetra.api.shared.Ratio;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

final class DecimalLiteralsTest {
    private static BigInteger minor(String literal, int decimals) {
        return DecimalLiterals.parseScaledAmount(literal, decimals).orElseThrow().value();
    }

    private static MonetaryError failure(String literal, int decimals) {
        var outcome = DecimalLiterals.parseScaledAmount(literal, decimals);
        assertTrue(outcome.isFailure(), () -> "expected failure for " + literal);
        return outcome.error().orElseThrow();
    }

    @ParameterizedTest
    @CsvSource({
            "10.50, 2, 1050",
            "10.5, 2, 1050",
            "10, 2, 1000",
            "-5.25, 2, -525",
            ".25, 2, 25",
            "-.5, 2, -50",
            "5., 2, 500",
            "0, 0, 0",
            "-0, 2, 0",
            "007.10, 2, 710",
            "100, 0, 100",
            "0.000000000000000001, 18, 1",
            "1.5, 18, 1500000000000000000"
    })
    void parsesValidLiterals(String literal, int decimals, long expected) {
        assertEquals(BigInteger.valueOf(expected), minor(literal, decimals));
    }

    @Test
    void parsesAmountsBeyondLongRange() {
        assertEquals(
                new BigInteger("12345678901234567890123456789012"),
                minor("123456789012345678901234567890.12", 2));
    }

    @ParameterizedTest
    @ValueSource(strings = {"1e5", "1E5", "1.5e-3", "1,000.00", "1 000", " 1", "+1", "1.2.3", "-", "", ".", "-.", "1-2", "--1", "$10", "abc", "10.5O"})
    void rejectsMalformedLiterals(String literal) {
        var error = failure(literal, 2);
        assertEquals(MonetaryErrorCode.FORMAT, error.code());
        assertInstanceOf(MonetaryError.Format.class, error);
        assertEquals(literal, ((MonetaryError.Format) error).literal());
    }

    @Test
    void scientificNotationIsReportedAsSuch() {
        var error = (MonetaryError.Format) failure("1e5", 2);
        assertTrue(error.reason().contains("scientific"));
    }

    @Test
    void excessPrecisionIsDistinctFromFormat() {
        var error = failure("100.001", 2);
        assertEquals(new MonetaryError.PrecisionExceeded(3, 2), error);
        assertEquals(MonetaryErrorCode.PRECISION_EXCEEDED, error.code());
        assertEquals(new MonetaryError.PrecisionExceeded(1, 0), failure("100.5", 0));
    }

    @Test
    void trailingZerosStillCountAsPrecision() {
        assertEquals(new MonetaryError.PrecisionExceeded(3, 2), failure("1.000", 2));
    }

    @Test
    void decimalsOutsideSupportedRangeAreRejected() {
        assertEquals(MonetaryErrorCode.INVALID_ARGUMENT, failure("1", 19).code());
        assertEquals(MonetaryErrorCode.INVALID_ARGUMENT, failure("1", -1).code());
    }

    @Test
    void parseRatioCountsFractionalDigits() {
        assertEquals(Ratio.of(555, 1000), DecimalLiterals.parseRatio("0.555").orElseThrow());
        assertEquals(Ratio.of(-15, 10), DecimalLiterals.parseRatio("-1.5").orElseThrow());
        assertEquals(Ratio.of(2), DecimalLiterals.parseRatio("2").orElseThrow());
        assertEquals(Ratio.of(150, 100), DecimalLiterals.parseRatio("1.50").orElseThrow());
    }

    @Test
    void parseRatioRejectsMalformedScalars() {
        assertEquals(MonetaryErrorCode.FORMAT, DecimalLiterals.parseRatio("1e3").error().orElseThrow().code());
        assertEquals(MonetaryErrorCode.FORMAT, DecimalLiterals.parseRatio("1/3").error().orElseThrow().code());
    }

    @ParameterizedTest
    @CsvSource({
            "1050, 2, 10.50",
            "-525, 2, -5.25",
            "5, 2, 0.05",
            "-5, 2, -0.05",
            "0, 2, 0.00",
            "123, 0, 123",
            "-123, 0, -123",
            "1, 18, 0.000000000000000001"
    })
    void rendersWithExactlyTheCurrencyDigits(long minor, int decimals, String expected) {
        assertEquals(expected, DecimalLiterals.render(MinorUnitAmount.of(minor), decimals));
    }

    @Test
    void renderThenParseIsIdentity() {
        var random = new Random(20_240_601L);
        for (var i = 0; i < 2_000; i++) {
            var decimals = random.nextInt(19);
            var value = new BigInteger(96, random);
            if (random.nextBoolean()) {
                value = value.negate();
            }
            var amount = new MinorUnitAmount(value);
            var rendered = DecimalLiterals.render(amount, decimals);
            assertEquals(amount, DecimalLiterals.parseScaledAmount(rendered, decimals).orElseThrow(), rendered);
        }
    }

    @Test
    void parseRenderParseIsStable() {
        var literals = new String[]{"0.1", "-12.3", "99", ".07", "5.", "-0.00"};
        for (var literal : literals) {
            var first = DecimalLiterals.parseScaledAmount(literal, 2).orElseThrow();
            var again = DecimalLiterals.parseScaledAmount(DecimalLiterals.render(first, 2), 2).orElseThrow();
            assertEquals(first, again, literal);
        }
    }
}
