package com.amannmalik.monetra.api.shared;

import com.amannmalik.monetra.util.Ensure;

import java.math.BigInteger;
import java.util.Locale;

/**
 * Metadata for a currency or token. Only {@link #decimals()} takes part in arithmetic; the
 * symbol and locale are carried for display layers.
 */
public record CurrencyDescriptor(CurrencyCode code, int decimals, String symbol, Locale locale) {
    public static final int MAX_DECIMALS = 18;

    public CurrencyDescriptor {
        code = Ensure.notNull("currency.code", code);
        decimals = Ensure.inRange("currency.decimals", decimals, 0, MAX_DECIMALS);
        symbol = symbol == null ? code.value() : Ensure.nonBlank("currency.symbol", symbol);
        locale = locale == null ? Locale.ROOT : locale;
    }

    public static CurrencyDescriptor of(String code, int decimals) {
        return new CurrencyDescriptor(new CurrencyCode(code), decimals, null, null);
    }

    public static CurrencyDescriptor of(String code, int decimals, String symbol) {
        return new CurrencyDescriptor(new CurrencyCode(code), decimals, symbol, null);
    }

    /// {@code 10^decimals}: the number of minor units in one major unit.
    public BigInteger scaleFactor() {
        return BigInteger.TEN.pow(decimals);
    }

    /// Same code at the same scale, so minor units of both are directly comparable.
    public boolean sameCurrency(CurrencyDescriptor other) {
        return code.equals(other.code) && decimals == other.decimals;
    }

    /// {@code "USD"}, or {@code "USD@0"} when the scale has to be spelled out.
    public String label(boolean withDecimals) {
        return withDecimals ? code.value() + "@" + decimals : code.value();
    }
}
