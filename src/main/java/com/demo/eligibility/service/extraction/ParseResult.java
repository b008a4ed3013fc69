package com.demo.eligibility.service.extraction;

import java.util.Objects;

/** Either parsed fields or the reason parsing gave up. Exactly one side is set. */
public record ParseResult<T>(T value, String error) {

    public ParseResult {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of value or error must be set");
        }
    }

    public static <T> ParseResult<T> ok(T value) {
        return new ParseResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> ParseResult<T> err(String reason) {
        return new ParseResult<>(null, Objects.requireNonNull(reason, "reason"));
    }

    public boolean isOk() {
        return value != null;
    }
}
