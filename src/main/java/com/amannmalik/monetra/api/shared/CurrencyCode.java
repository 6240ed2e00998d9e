package com.amannmalik.monetra.api.shared;

import com.amannmalik.monetra.util.Ensure;

import java.util.Locale;
import java.util.regex.Pattern;

/// ISO-4217 code or a token ticker such as {@code USDC}. Always held upper-case.
public record CurrencyCode(String value) {
    private static final Pattern CODE = Pattern.compile("^[A-Z][A-Z0-9]{1,11}$");

    public CurrencyCode {
        var normalized = Ensure.nonBlank("currency", value).strip().toUpperCase(Locale.ROOT);
        if (!CODE.matcher(normalized).matches()) {
            throw new IllegalArgumentException("currency MUST be an ISO-4217 code or token ticker");
        }
        value = normalized;
    }

    @Override
    public String toString() {
        return value;
    }
}
