package com.amannmalik.monetra.api.result;

import com.amannmalik.monetra.util.Ensure;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

/**
 * Closed set of conditions a monetary operation can end in instead of a value. Every kind
 * is permanent for the attempted operation: nothing is retried internally.
 */
public sealed interface MonetaryError {
    MonetaryErrorCode code();

    String message();

    /// Name of the offending input, when one can be singled out.
    default String param() {
        return null;
    }

    /// Malformed literal: exponent, stray characters, several decimal points or no digits.
    record Format(String literal, String reason) implements MonetaryError {
        public Format {
            literal = Ensure.notNull("format.literal", literal);
            reason = Ensure.nonBlank("format.reason", reason);
        }

        @Override
        public MonetaryErrorCode code() {
            return MonetaryErrorCode.FORMAT;
        }

        @Override
        public String message() {
            return "Invalid decimal literal '" + literal + "': " + reason;
        }

        @Override
        public String param() {
            return "literal";
        }
    }

    /// The literal carries more fractional digits than the currency allows.
    record PrecisionExceeded(int digits, int limit) implements MonetaryError {
        @Override
        public MonetaryErrorCode code() {
            return MonetaryErrorCode.PRECISION_EXCEEDED;
        }

        @Override
        public String message() {
            return "Precision " + digits + " exceeds currency decimals " + limit;
        }

        @Override
        public String param() {
            return "decimals";
        }
    }

    record DivisionByZero(String operation) implements MonetaryError {
        public DivisionByZero {
            operation = Ensure.nonBlank("division_by_zero.operation", operation);
        }

        @Override
        public MonetaryErrorCode code() {
            return MonetaryErrorCode.DIVISION_BY_ZERO;
        }

        @Override
        public String message() {
            return "Division by zero in " + operation;
        }
    }

    /**
     * An inexact result was produced and no rounding policy was given. Carries the exact,
     * unrounded quotient {@code numerator / denominator} so the caller can pick a policy and
     * retry.
     */
    record RoundingRequired(String operation, BigInteger numerator, BigInteger denominator)
            implements MonetaryError {
        public RoundingRequired {
            operation = Ensure.nonBlank("rounding_required.operation", operation);
            numerator = Ensure.notNull("rounding_required.numerator", numerator);
            denominator = Ensure.notNull("rounding_required.denominator", denominator);
        }

        /// For diagnostics only; never fed back into arithmetic.
        public BigDecimal approximateResult() {
            return new BigDecimal(numerator).divide(new BigDecimal(denominator), MathContext.DECIMAL64);
        }

        @Override
        public MonetaryErrorCode code() {
            return MonetaryErrorCode.ROUNDING_REQUIRED;
        }

        @Override
        public String message() {
            return "Rounding required for " + operation + ": result " + approximateResult().toPlainString()
                    + " is not an integer; provide one of HALF_UP, HALF_DOWN, HALF_EVEN, FLOOR, CEIL, TRUNCATE";
        }

        @Override
        public String param() {
            return "policy";
        }
    }

    record UnsupportedPolicy(String value) implements MonetaryError {
        public UnsupportedPolicy {
            value = String.valueOf(value);
        }

        @Override
        public MonetaryErrorCode code() {
            return MonetaryErrorCode.UNSUPPORTED_POLICY;
        }

        @Override
        public String message() {
            return "Unsupported rounding policy: " + value;
        }

        @Override
        public String param() {
            return "policy";
        }
    }

    record EmptyWeights() implements MonetaryError {
        @Override
        public MonetaryErrorCode code() {
            return MonetaryErrorCode.EMPTY_WEIGHTS;
        }

        @Override
        public String message() {
            return "Cannot allocate to empty weights";
        }

        @Override
        public String param() {
            return "weights";
        }
    }

    record ZeroTotalWeight() implements MonetaryError {
        @Override
        public MonetaryErrorCode code() {
            return MonetaryErrorCode.ZERO_TOTAL_WEIGHT;
        }

        @Override
        public String message() {
            return "Total weight must be greater than zero";
        }

        @Override
        public String param() {
            return "weights";
        }
    }

    record CurrencyMismatch(String expected, String received) implements MonetaryError {
        public CurrencyMismatch {
            expected = Ensure.nonBlank("currency_mismatch.expected", expected);
            received = Ensure.nonBlank("currency_mismatch.received", received);
        }

        @Override
        public MonetaryErrorCode code() {
            return MonetaryErrorCode.CURRENCY_MISMATCH;
        }

        @Override
        public String message() {
            return "Currency mismatch: expected " + expected + ", received " + received;
        }

        @Override
        public String param() {
            return "currency";
        }
    }

    record InvalidArgument(String param, String message) implements MonetaryError {
        public InvalidArgument {
            param = Ensure.nonBlank("invalid_argument.param", param);
            message = Ensure.nonBlank("invalid_argument.message", message);
        }

        @Override
        public MonetaryErrorCode code() {
            return MonetaryErrorCode.INVALID_ARGUMENT;
        }
    }
}
