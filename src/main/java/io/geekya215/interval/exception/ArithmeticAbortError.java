package io.geekya215.interval.exception;

import org.jetbrains.annotations.NotNull;

// Not meant to be caught: the operation that raised it has no result.
public class ArithmeticAbortError extends Error {
    private static final String TEMPLATE = "Aborted on %s: %s";

    private final @NotNull Violation violation;

    public ArithmeticAbortError(@NotNull Violation violation, @NotNull String detail) {
        super(String.format(TEMPLATE, violation, detail));
        this.violation = violation;
    }

    public @NotNull Violation violation() {
        return violation;
    }
}
