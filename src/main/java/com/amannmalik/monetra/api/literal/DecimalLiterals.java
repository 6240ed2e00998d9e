package com.amannmalik.monetra.api.literal;

import com.amannmalik.monetra.api.result.MonetaryError;
import com.amannmalik.monetra.api.result.Outcome;
import com.amannmalik.monetra.api.shared.CurrencyDescriptor;
import com.amannmalik.monetra.api.shared.MinorUnitAmount;
import com.amannmalik.monetra.api.shared.Ratio;
import com.amannmalik.monetra.util.Ensure;

import java.math.BigInteger;

/**
 * Strict parser for plain decimal literals such as {@code "10.50"}, {@code "-3"} or
 * {@code ".25"}.
 *
 * <p>A literal is an optional leading minus sign followed by digits with at most one decimal
 * point. Exponents, grouping separators, whitespace and explicit plus signs are rejected;
 * locale-specific input has to be normalised before it gets here.
 */
public final class DecimalLiterals {
    private DecimalLiterals() {
    }

    /**
     * Converts a major-unit literal into minor units for a currency with {@code decimals}
     * fractional digits.
     *
     * @return the scaled amount, {@link MonetaryError.Format} for malformed input, or
     *         {@link MonetaryError.PrecisionExceeded} when the literal has more fractional
     *         digits than {@code decimals}
     */
    public static Outcome<MinorUnitAmount> parseScaledAmount(String literal, int decimals) {
        if (decimals < 0 || decimals > CurrencyDescriptor.MAX_DECIMALS) {
            return Outcome.failure(new MonetaryError.InvalidArgument(
                    "decimals", "decimals MUST be between 0 and " + CurrencyDescriptor.MAX_DECIMALS));
        }
        return split(literal).flatMap(parts -> {
            var fraction = parts.fraction();
            if (fraction.length() > decimals) {
                return Outcome.failure(new MonetaryError.PrecisionExceeded(fraction.length(), decimals));
            }
            var digits = parts.integer() + fraction + "0".repeat(decimals - fraction.length());
            var magnitude = new BigInteger(digits);
            return Outcome.success(new MinorUnitAmount(parts.negative() ? magnitude.negate() : magnitude));
        });
    }

    public static Outcome<MinorUnitAmount> parseScaledAmount(String literal, CurrencyDescriptor currency) {
        return parseScaledAmount(literal, Ensure.notNull("currency", currency).decimals());
    }

    /**
     * Derives an exact ratio from a scalar literal: every digit forms the numerator and the
     * denominator is {@code 10^(fractional digit count)}, so {@code "0.555"} becomes
     * {@code 555/1000}.
     */
    public static Outcome<Ratio> parseRatio(String literal) {
        return split(literal).map(parts -> {
            var magnitude = new BigInteger(parts.integer() + parts.fraction());
            var numerator = parts.negative() ? magnitude.negate() : magnitude;
            return new Ratio(numerator, BigInteger.TEN.pow(parts.fraction().length()));
        });
    }

    /// Inverse of {@link #parseScaledAmount(String, int)}: renders minor units as a plain
    /// decimal string with exactly {@code decimals} fractional digits.
    public static String render(MinorUnitAmount amount, int decimals) {
        Ensure.inRange("decimals", decimals, 0, CurrencyDescriptor.MAX_DECIMALS);
        var value = Ensure.notNull("amount", amount).value();
        var digits = value.abs().toString();
        var sign = value.signum() < 0 ? "-" : "";
        if (decimals == 0) {
            return sign + digits;
        }
        if (digits.length() <= decimals) {
            digits = "0".repeat(decimals - digits.length() + 1) + digits;
        }
        var point = digits.length() - decimals;
        return sign + digits.substring(0, point) + "." + digits.substring(point);
    }

    private static Outcome<LiteralParts> split(String literal) {
        Ensure.notNull("literal", literal);
        var hasDigit = false;
        var points = 0;
        for (var i = 0; i < literal.length(); i++) {
            var c = literal.charAt(i);
            if (c == 'e' || c == 'E') {
                return format(literal, "scientific notation is not supported");
            }
            if (c >= '0' && c <= '9') {
                hasDigit = true;
            } else if (c == '.') {
                points++;
            } else if (c == '-') {
                if (i != 0) {
                    return format(literal, "minus sign is only allowed as the first character");
                }
            } else {
                return format(literal, "unexpected character '" + c + "'");
            }
        }
        if (!hasDigit) {
            return format(literal, "no digits");
        }
        if (points > 1) {
            return format(literal, "multiple decimal points");
        }
        var negative = literal.charAt(0) == '-';
        var unsigned = negative ? literal.substring(1) : literal;
        var point = unsigned.indexOf('.');
        var integer = point < 0 ? unsigned : unsigned.substring(0, point);
        var fraction = point < 0 ? "" : unsigned.substring(point + 1);
        return Outcome.success(new LiteralParts(negative, integer.isEmpty() ? "0" : integer, fraction));
    }

    private static <T> Outcome<T> format(String literal, String reason) {
        return Outcome.failure(new MonetaryError.Format(literal, reason));
    }

    private record LiteralParts(boolean negative, String integer, String fraction) {
    }
}
