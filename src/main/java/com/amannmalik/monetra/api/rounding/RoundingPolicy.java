package com.amannmalik.monetra.api.rounding;

import com.amannmalik.monetra.api.result.MonetaryError;
import com.amannmalik.monetra.api.result.Outcome;

import java.math.RoundingMode;
import java.util.Locale;

/// How an inexact quotient is turned into whole minor units.
public enum RoundingPolicy {
    /// Nearest neighbour, ties away from zero: 2.5 -> 3, -2.5 -> -3.
    HALF_UP(RoundingMode.HALF_UP),
    /// Nearest neighbour, ties toward zero: 2.5 -> 2, -2.5 -> -2.
    HALF_DOWN(RoundingMode.HALF_DOWN),
    /// Nearest neighbour, ties to the even neighbour (banker's rounding): 2.5 -> 2, 3.5 -> 4.
    HALF_EVEN(RoundingMode.HALF_EVEN),
    /// Toward negative infinity: 2.9 -> 2, -2.1 -> -3.
    FLOOR(RoundingMode.FLOOR),
    /// Toward positive infinity: 2.1 -> 3, -2.9 -> -2.
    CEIL(RoundingMode.CEILING),
    /// Toward zero: 2.9 -> 2, -2.9 -> -2.
    TRUNCATE(RoundingMode.DOWN);

    private final RoundingMode roundingMode;

    RoundingPolicy(RoundingMode roundingMode) {
        this.roundingMode = roundingMode;
    }

    /// The equivalent JDK mode, for callers that hand values to {@link java.math.BigDecimal}.
    public RoundingMode toRoundingMode() {
        return roundingMode;
    }

    /// Case-insensitive lookup by name; {@code CEILING} is accepted for {@link #CEIL}.
    public static Outcome<RoundingPolicy> parse(String name) {
        if (name == null || name.isBlank()) {
            return Outcome.failure(new MonetaryError.UnsupportedPolicy(name));
        }
        var normalized = name.strip().toUpperCase(Locale.ROOT).replace('-', '_');
        if (normalized.equals("CEILING")) {
            return Outcome.success(CEIL);
        }
        for (var policy : values()) {
            if (policy.name().equals(normalized)) {
                return Outcome.success(policy);
            }
        }
        return Outcome.failure(new MonetaryError.UnsupportedPolicy(name));
    }
}
