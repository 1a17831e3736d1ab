package com.taskforge.core.intent;

import java.util.function.Function;

/**
 * Either a decoded value or a {@link ParseError}; exactly one is non-null.
 */
public record DecodeResult<T>(T value, ParseError error) {

    public static <T> DecodeResult<T> success(T value) {
        return new DecodeResult<>(value, null);
    }

    public static <T> DecodeResult<T> failure(String message) {
        return new DecodeResult<>(null, new ParseError(message));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public <R> DecodeResult<R> map(Function<T, R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : new DecodeResult<>(null, error);
    }
}
