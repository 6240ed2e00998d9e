package com.amannmalik.monetra.codec;

import jakarta.json.*;

import java.io.InputStream;

final class JsonSupport {
    private JsonSupport() {
    }

    static JsonObject readObject(InputStream body) {
        try (JsonReader reader = Json.createReader(body)) {
            return reader.readObject();
        } catch (JsonException | IllegalStateException e) {
            throw new JsonDecodingException("Malformed JSON object", e);
        }
    }

    static String requireString(JsonObject parent, String key) {
        if (!parent.containsKey(key) || parent.isNull(key)) {
            throw new JsonDecodingException("Missing string: " + key);
        }
        var value = parent.get(key);
        if (value.getValueType() != JsonValue.ValueType.STRING) {
            throw new JsonDecodingException("Expected string at: " + key);
        }
        var string = ((JsonString) value).getString();
        if (string.isBlank()) {
            throw new JsonDecodingException("String MUST be non-blank: " + key);
        }
        return string;
    }

    static int requireInt(JsonObject parent, String key) {
        if (!parent.containsKey(key) || parent.isNull(key)) {
            throw new JsonDecodingException("Missing integer: " + key);
        }
        var value = parent.get(key);
        if (!(value instanceof JsonNumber number)) {
            throw new JsonDecodingException("Expected integer at: " + key);
        }
        try {
            return number.intValueExact();
        } catch (ArithmeticException e) {
            throw new JsonDecodingException("Expected integer at: " + key, e);
        }
    }
}
