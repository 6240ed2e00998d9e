package com.amannmalik.monetra.api.shared;

import com.amannmalik.monetra.api.result.MonetaryError;
import com.amannmalik.monetra.util.Ensure;

/// Wire shape of a {@link MonetaryError}: kind, stable code, message and optional parameter.
public record ErrorResponse(String type, String code, String message, String param) {
    public ErrorResponse {
        type = Ensure.nonBlank("error.type", type);
        code = Ensure.nonBlank("error.code", code);
        message = Ensure.nonBlank("error.message", message);
        if (param != null && param.isBlank()) {
            throw new IllegalArgumentException("error.param MUST be non-blank when provided");
        }
    }

    public static ErrorResponse from(MonetaryError error) {
        Ensure.notNull("error", error);
        return new ErrorResponse(error.code().type(), error.code().code(), error.message(), error.param());
    }
}
