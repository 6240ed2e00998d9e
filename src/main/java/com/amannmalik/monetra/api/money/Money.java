package com.amannmalik.monetra.api.money;

import com.amannmalik.monetra.api.allocation.LargestRemainderAllocator;
import com.amannmalik.monetra.api.arithmetic.ScaledArithmetic;
import com.amannmalik.monetra.api.literal.DecimalLiterals;
import com.amannmalik.monetra.api.result.MonetaryError;
import com.amannmalik.monetra.api.result.MonetaryException;
import com.amannmalik.monetra.api.result.Outcome;
import com.amannmalik.monetra.api.rounding.RoundingPolicy;
import com.amannmalik.monetra.api.shared.CurrencyDescriptor;
import com.amannmalik.monetra.api.shared.MinorUnitAmount;
import com.amannmalik.monetra.api.shared.Ratio;
import com.amannmalik.monetra.util.Ensure;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;

/**
 * An immutable amount of a single currency, held in minor units.
 *
 * <p>Two values are equal when their minor units and currency codes are equal; symbol and
 * locale do not take part. Ordering and arithmetic between values of different currencies
 * fail with {@link MonetaryError.CurrencyMismatch}.
 *
 * <p>Operations that can end in a rounding or allocation error return an {@link Outcome}.
 * Operations whose only failure is a currency mismatch or an invalid argument throw
 * {@link MonetaryException}.
 */
public final class Money implements Comparable<Money> {
    public static final RoundingPolicy DEFAULT_PERCENT_POLICY = RoundingPolicy.HALF_EVEN;
    private static final BigInteger HUNDRED = BigInteger.valueOf(100);

    private final MinorUnitAmount amount;
    private final CurrencyDescriptor currency;

    private Money(MinorUnitAmount amount, CurrencyDescriptor currency) {
        this.amount = Ensure.notNull("money.amount", amount);
        this.currency = Ensure.notNull("money.currency", currency);
    }

    public static Money of(MinorUnitAmount amount, CurrencyDescriptor currency) {
        return new Money(amount, currency);
    }

    public static Money ofMinor(BigInteger minor, CurrencyDescriptor currency) {
        return new Money(new MinorUnitAmount(minor), currency);
    }

    public static Money ofMinor(long minor, CurrencyDescriptor currency) {
        return new Money(MinorUnitAmount.of(minor), currency);
    }

    public static Money zero(CurrencyDescriptor currency) {
        return new Money(MinorUnitAmount.zero(), currency);
    }

    /// Parses a major-unit literal such as {@code "10.50"}.
    public static Outcome<Money> parse(String literal, CurrencyDescriptor currency) {
        Ensure.notNull("currency", currency);
        return DecimalLiterals.parseScaledAmount(literal, currency.decimals()).map(minor -> new Money(minor, currency));
    }

    public static Money min(Money first, Money... rest) {
        var min = Ensure.notNull("first", first);
        for (var candidate : rest) {
            if (min.compareTo(candidate) > 0) {
                min = candidate;
            }
        }
        return min;
    }

    public static Money max(Money first, Money... rest) {
        var max = Ensure.notNull("first", first);
        for (var candidate : rest) {
            if (max.compareTo(candidate) < 0) {
                max = candidate;
            }
        }
        return max;
    }

    public static Money min(List<Money> values) {
        requireNonEmpty(values);
        return min(values.get(0), values.subList(1, values.size()).toArray(Money[]::new));
    }

    public static Money max(List<Money> values) {
        requireNonEmpty(values);
        return max(values.get(0), values.subList(1, values.size()).toArray(Money[]::new));
    }

    public MinorUnitAmount amount() {
        return amount;
    }

    public BigInteger minor() {
        return amount.value();
    }

    public CurrencyDescriptor currency() {
        return currency;
    }

    public Money add(Money other) {
        requireSameCurrency(other);
        return new Money(amount.plus(other.amount), currency);
    }

    public Money subtract(Money other) {
        requireSameCurrency(other);
        return new Money(amount.minus(other.amount), currency);
    }

    public Outcome<Money> multiply(Ratio multiplier) {
        return multiply(multiplier, null);
    }

    public Outcome<Money> multiply(Ratio multiplier, RoundingPolicy policy) {
        return ScaledArithmetic.multiply(amount, multiplier, policy).map(this::withAmount);
    }

    public Outcome<Money> multiply(String multiplier, RoundingPolicy policy) {
        return ScaledArithmetic.multiply(amount, multiplier, policy).map(this::withAmount);
    }

    public Outcome<Money> divide(Ratio divisor) {
        return divide(divisor, null);
    }

    public Outcome<Money> divide(Ratio divisor, RoundingPolicy policy) {
        return ScaledArithmetic.divide(amount, divisor, policy).map(this::withAmount);
    }

    public Outcome<Money> divide(String divisor, RoundingPolicy policy) {
        return ScaledArithmetic.divide(amount, divisor, policy).map(this::withAmount);
    }

    /// Splits this value by {@code weights}; the parts always add back up to this value.
    public Outcome<List<Money>> allocate(List<Ratio> weights) {
        return LargestRemainderAllocator.allocate(amount, weights).map(this::withAmounts);
    }

    public Outcome<List<Money>> allocateLiterals(List<String> weights) {
        return LargestRemainderAllocator.allocateLiterals(amount, weights).map(this::withAmounts);
    }

    /// Splits into {@code parts} near-equal values, earlier parts receiving any extra unit.
    public Outcome<List<Money>> split(int parts) {
        if (parts < 1) {
            return Outcome.failure(new MonetaryError.InvalidArgument("parts", "parts MUST be >= 1"));
        }
        return allocate(Collections.nCopies(parts, Ratio.ONE));
    }

    /// {@code percent} per cent of this value, e.g. {@code percentage(Ratio.of(15), HALF_EVEN)}.
    public Outcome<Money> percentage(Ratio percent, RoundingPolicy policy) {
        Ensure.notNull("percent", percent);
        return multiply(percent.dividedBy(HUNDRED), policy);
    }

    public Outcome<Money> percentage(Ratio percent) {
        return percentage(percent, DEFAULT_PERCENT_POLICY);
    }

    public Outcome<Money> addPercent(Ratio percent, RoundingPolicy policy) {
        return percentage(percent, policy).map(this::add);
    }

    public Outcome<Money> subtractPercent(Ratio percent, RoundingPolicy policy) {
        return percentage(percent, policy).map(this::subtract);
    }

    public Money negate() {
        return new Money(amount.negate(), currency);
    }

    public Money abs() {
        return isNegative() ? negate() : this;
    }

    public boolean isZero() {
        return amount.signum() == 0;
    }

    public boolean isPositive() {
        return amount.signum() > 0;
    }

    public boolean isNegative() {
        return amount.signum() < 0;
    }

    public boolean greaterThan(Money other) {
        return compareTo(other) > 0;
    }

    public boolean greaterThanOrEqual(Money other) {
        return compareTo(other) >= 0;
    }

    public boolean lessThan(Money other) {
        return compareTo(other) < 0;
    }

    public boolean lessThanOrEqual(Money other) {
        return compareTo(other) <= 0;
    }

    /// @throws MonetaryException when {@code min > max} or the currencies differ
    public Money clamp(Money min, Money max) {
        requireSameCurrency(min);
        requireSameCurrency(max);
        if (min.greaterThan(max)) {
            throw new MonetaryException(new MonetaryError.InvalidArgument("min", "Clamp min cannot be greater than max"));
        }
        if (lessThan(min)) {
            return new Money(min.amount, currency);
        }
        if (greaterThan(max)) {
            return new Money(max.amount, currency);
        }
        return this;
    }

    /// @throws MonetaryException when the currencies differ
    @Override
    public int compareTo(Money other) {
        requireSameCurrency(other);
        return amount.compareTo(other.amount);
    }

    /// Plain decimal form with exactly {@code decimals} fractional digits, e.g. {@code "-5.25"}.
    public String toDecimalString() {
        return DecimalLiterals.render(amount, currency.decimals());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Money other)) {
            return false;
        }
        return amount.equals(other.amount) && currency.sameCurrency(other.currency);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * amount.hashCode() + currency.code().hashCode()) + currency.decimals();
    }

    @Override
    public String toString() {
        return toDecimalString() + " " + currency.code();
    }

    private Money withAmount(MinorUnitAmount minor) {
        return new Money(minor, currency);
    }

    private List<Money> withAmounts(List<MinorUnitAmount> parts) {
        return parts.stream().map(this::withAmount).toList();
    }

    private void requireSameCurrency(Money other) {
        Ensure.notNull("other", other);
        if (!currency.sameCurrency(other.currency)) {
            var scaleOnly = currency.code().equals(other.currency.code());
            throw new MonetaryException(new MonetaryError.CurrencyMismatch(
                    currency.label(scaleOnly), other.currency.label(scaleOnly)));
        }
    }

    private static void requireNonEmpty(List<Money> values) {
        if (Ensure.notNull("values", values).isEmpty()) {
            throw new MonetaryException(new MonetaryError.InvalidArgument("values", "At least one Money value required"));
        }
    }
}
