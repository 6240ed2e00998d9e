package com.amannmalik.monetra.api.allocation;

import com.amannmalik.monetra.api.literal.DecimalLiterals;
import com.amannmalik.monetra.api.result.MonetaryError;
import com.amannmalik.monetra.api.result.Outcome;
import com.amannmalik.monetra.api.shared.MinorUnitAmount;
import com.amannmalik.monetra.api.shared.Ratio;
import com.amannmalik.monetra.util.Ensure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Splits an amount by weights with the Largest Remainder Method.
 *
 * <p>Every part receives the floor of its exact share; the units left over are handed out one
 * at a time to the parts with the largest remainders, lower index first on ties. The parts
 * always sum to the input and each differs from its exact share by less than one minor unit.
 */
public final class LargestRemainderAllocator {
    private static final Logger LOG = LoggerFactory.getLogger(LargestRemainderAllocator.class);

    private LargestRemainderAllocator() {
    }

    /**
     * @param weights non-negative weights, at least one, with a positive total
     * @return parts in the order of {@code weights}, or {@link MonetaryError.EmptyWeights},
     *         {@link MonetaryError.ZeroTotalWeight} or {@link MonetaryError.InvalidArgument} for a
     *         negative weight
     */
    public static Outcome<List<MinorUnitAmount>> allocate(MinorUnitAmount amount, List<Ratio> weights) {
        Ensure.notNull("amount", amount);
        Ensure.notNull("weights", weights);
        if (weights.isEmpty()) {
            return Outcome.failure(new MonetaryError.EmptyWeights());
        }
        for (var i = 0; i < weights.size(); i++) {
            if (Ensure.notNull("weights[" + i + "]", weights.get(i)).signum() < 0) {
                return Outcome.failure(new MonetaryError.InvalidArgument(
                        "weights[" + i + "]", "Allocation weights MUST be >= 0"));
            }
        }
        var normalized = normalize(weights);
        var total = normalized.stream().reduce(BigInteger.ZERO, BigInteger::add);
        if (total.signum() == 0) {
            return Outcome.failure(new MonetaryError.ZeroTotalWeight());
        }

        var shares = new Share[normalized.size()];
        var allocated = BigInteger.ZERO;
        for (var i = 0; i < shares.length; i++) {
            var qr = amount.value().multiply(normalized.get(i)).divideAndRemainder(total);
            var share = qr[0];
            var remainder = qr[1];
            if (remainder.signum() < 0) {
                share = share.subtract(BigInteger.ONE);
                remainder = remainder.add(total);
            }
            shares[i] = new Share(i, share, remainder);
            allocated = allocated.add(share);
        }

        var leftover = amount.value().subtract(allocated).intValueExact();
        if (leftover > 0) {
            LOG.debug("Distributing {} leftover unit(s) across {} part(s)", leftover, shares.length);
            var byRemainder = shares.clone();
            Arrays.sort(byRemainder, Comparator.comparing(Share::remainder, Comparator.<BigInteger>reverseOrder())
                    .thenComparingInt(Share::index));
            for (var i = 0; i < leftover; i++) {
                var share = byRemainder[i];
                shares[share.index()] = new Share(share.index(), share.amount().add(BigInteger.ONE), share.remainder());
            }
        }

        var parts = new ArrayList<MinorUnitAmount>(shares.length);
        for (var share : shares) {
            parts.add(new MinorUnitAmount(share.amount()));
        }
        return Outcome.success(List.copyOf(parts));
    }

    /// Weights given as decimal literals, e.g. {@code ["0.7", "0.2", "0.1"]}.
    public static Outcome<List<MinorUnitAmount>> allocateLiterals(MinorUnitAmount amount, List<String> weights) {
        Ensure.notNull("weights", weights);
        var ratios = new ArrayList<Ratio>(weights.size());
        for (var weight : weights) {
            var parsed = DecimalLiterals.parseRatio(weight);
            if (parsed.isFailure()) {
                return Outcome.failure(parsed.error().orElseThrow());
            }
            ratios.add(parsed.orElseThrow());
        }
        return allocate(amount, ratios);
    }

    /// Rescales every weight onto the least common denominator so they can be compared as integers.
    static List<BigInteger> normalize(List<Ratio> weights) {
        var common = BigInteger.ONE;
        for (var weight : weights) {
            var denominator = weight.denominator();
            common = common.divide(common.gcd(denominator)).multiply(denominator);
        }
        var normalized = new ArrayList<BigInteger>(weights.size());
        for (var weight : weights) {
            normalized.add(weight.numerator().multiply(common.divide(weight.denominator())));
        }
        return normalized;
    }

    private record Share(int index, BigInteger amount, BigInteger remainder) {
    }
}
