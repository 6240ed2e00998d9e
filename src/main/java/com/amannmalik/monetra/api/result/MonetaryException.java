package com.amannmalik.monetra.api.result;

import com.amannmalik.monetra.util.Ensure;

/// Unchecked carrier for a {@link MonetaryError}, raised when a caller unwraps a failed
/// {@link Outcome} or uses an operation that cannot return one.
public final class MonetaryException extends RuntimeException {
    private final transient MonetaryError error;

    public MonetaryException(MonetaryError error) {
        super(Ensure.notNull("error", error).message());
        this.error = error;
    }

    public MonetaryError error() {
        return error;
    }

    public MonetaryErrorCode code() {
        return error.code();
    }
}
