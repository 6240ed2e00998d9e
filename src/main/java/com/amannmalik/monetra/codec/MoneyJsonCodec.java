package com.amannmalik.monetra.codec;

import com.amannmalik.monetra.api.money.Money;
import com.amannmalik.monetra.api.shared.CurrencyDescriptor;
import jakarta.json.Json;
import jakarta.json.JsonArray;
import jakarta.json.JsonObject;

import java.io.InputStream;
import java.io.OutputStream;
import java.math.BigInteger;
import java.util.List;
import java.util.regex.Pattern;

/**
 * JSON form of {@link Money}:
 * {@code {"amount": "1050", "currency": "USD", "precision": 2}}.
 *
 * <p>The amount is a string of minor units so that values beyond the range of a JSON number
 * survive every parser. Decoding rebuilds the currency from code and precision alone.
 */
public final class MoneyJsonCodec {
    private static final Pattern MINOR_UNITS = Pattern.compile("^-?[0-9]+$");

    public Money read(InputStream body) {
        return read(JsonSupport.readObject(body));
    }

    public Money read(JsonObject object) {
        var amount = JsonSupport.requireString(object, "amount");
        if (!MINOR_UNITS.matcher(amount).matches()) {
            throw new JsonDecodingException("Expected integer string at: amount");
        }
        var code = JsonSupport.requireString(object, "currency");
        var precision = JsonSupport.requireInt(object, "precision");
        CurrencyDescriptor currency;
        try {
            currency = CurrencyDescriptor.of(code, precision);
        } catch (IllegalArgumentException e) {
            throw new JsonDecodingException("Invalid currency: " + e.getMessage(), e);
        }
        return Money.ofMinor(new BigInteger(amount), currency);
    }

    public JsonObject toJson(Money money) {
        return Json.createObjectBuilder()
                .add("amount", money.minor().toString())
                .add("currency", money.currency().code().value())
                .add("precision", money.currency().decimals())
                .build();
    }

    public JsonArray toJson(List<Money> values) {
        var array = Json.createArrayBuilder();
        values.forEach(value -> array.add(toJson(value)));
        return array.build();
    }

    public void write(OutputStream outputStream, Money money) {
        ErrorJson.writeObject(toJson(money), outputStream);
    }

    public void write(OutputStream outputStream, List<Money> values) {
        ErrorJson.writeObject(toJson(values), outputStream);
    }
}
