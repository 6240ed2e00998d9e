package com.amannmalik.monetra.codec;

import com.amannmalik.monetra.api.result.MonetaryError;
import com.amannmalik.monetra.api.shared.ErrorResponse;
import jakarta.json.Json;
import jakarta.json.JsonObjectBuilder;
import jakarta.json.JsonStructure;

import java.io.*;
import java.nio.charset.StandardCharsets;

public final class ErrorJson {
    private ErrorJson() {
    }

    public static void write(OutputStream outputStream, MonetaryError error) {
        writeObject(build(ErrorResponse.from(error)).build(), outputStream);
    }

    public static String toJson(MonetaryError error) {
        return build(ErrorResponse.from(error)).build().toString();
    }

    static JsonObjectBuilder build(ErrorResponse error) {
        var builder = Json.createObjectBuilder()
                .add("type", error.type())
                .add("code", error.code())
                .add("message", error.message());
        if (error.param() != null) {
            builder.add("param", error.param());
        }
        return builder;
    }

    static void writeObject(JsonStructure json, OutputStream stream) {
        try (Writer writer = new OutputStreamWriter(stream, StandardCharsets.UTF_8)) {
            Json.createWriter(writer).write(json);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
