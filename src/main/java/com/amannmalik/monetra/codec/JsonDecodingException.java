package com.amannmalik.monetra.codec;

public final class JsonDecodingException extends RuntimeException {
    public JsonDecodingException(String message) {
        super(message);
    }

    public JsonDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
