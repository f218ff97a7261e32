package io.geekya215.interval.exception;

import org.jetbrains.annotations.NotNull;

public class CheckFailure extends RuntimeException {
    private static final String TEMPLATE = "Check failed on %s: %s";

    private final @NotNull Violation violation;

    public CheckFailure(@NotNull Violation violation, @NotNull String detail) {
        super(String.format(TEMPLATE, violation, detail));
        this.violation = violation;
    }

    public @NotNull Violation violation() {
        return violation;
    }
}
