package com.amannmalik.monetra.codec.tests;

import com.amannmalik.monetra.api.result.MonetaryError;
import com.amannmalik.monetra.codec.ErrorJson;
import jakarta.json.Json;
import jakarta.json.JsonObject;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.StringReader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

final class ErrorJsonTest {
    private static JsonObject parse(String json) {
        try (var reader = Json.createReader(new StringReader(json))) {
            return reader.readObject();
        }
    }

    @Test
    void roundingRequiredCarriesCodeAndParam() {
        var error = new MonetaryError.RoundingRequired("multiply", BigInteger.valueOf(55_500), BigInteger.valueOf(1_000));
        var json = parse(ErrorJson.toJson(error));
        assertEquals("rounding_required", json.getString("type"));
        assertEquals("MONETRA_ROUNDING_REQUIRED", json.getString("code"));
        assertEquals("policy", json.getString("param"));
        assertTrue(json.getString("message").contains("55.5"));
    }

    @Test
    void paramIsOmittedWhenAbsent() {
        var json = parse(ErrorJson.toJson(new MonetaryError.DivisionByZero("divide")));
        assertEquals("MONETRA_DIVISION_BY_ZERO", json.getString("code"));
        assertFalse(json.containsKey("param"));
    }

    @Test
    void writesToStreams() {
        var out = new ByteArrayOutputStream();
        ErrorJson.write(out, new MonetaryError.ZeroTotalWeight());
        var json = parse(out.toString(StandardCharsets.UTF_8));
        assertEquals("zero_total_weight", json.getString("type"));
        assertEquals("weights", json.getString("param"));
    }
}
