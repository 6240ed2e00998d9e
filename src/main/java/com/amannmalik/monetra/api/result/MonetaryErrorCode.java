package com.amannmalik.monetra.api.result;

import java.util.Locale;

/// Stable codes for programmatic handling of {@link MonetaryError}s.
public enum MonetaryErrorCode {
    FORMAT("MONETRA_FORMAT"),
    PRECISION_EXCEEDED("MONETRA_INVALID_PRECISION"),
    DIVISION_BY_ZERO("MONETRA_DIVISION_BY_ZERO"),
    ROUNDING_REQUIRED("MONETRA_ROUNDING_REQUIRED"),
    UNSUPPORTED_POLICY("MONETRA_UNSUPPORTED_POLICY"),
    EMPTY_WEIGHTS("MONETRA_EMPTY_WEIGHTS"),
    ZERO_TOTAL_WEIGHT("MONETRA_ZERO_TOTAL_WEIGHT"),
    CURRENCY_MISMATCH("MONETRA_CURRENCY_MISMATCH"),
    INVALID_ARGUMENT("MONETRA_INVALID_ARGUMENT");

    private final String code;

    MonetaryErrorCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /// Snake-case kind name, e.g. {@code rounding_required}.
    public String type() {
        return name().toLowerCase(Locale.ROOT);
    }
}
