package io.geekya215.interval.checked;

import org.jetbrains.annotations.NotNull;

public enum Op {
    NEGATE("-", true),
    COMPLEMENT("~", true),
    ADD("+", false),
    SUBTRACT("-", false),
    MULTIPLY("*", false),
    DIVIDE("/", false),
    REMAINDER("%", false);

    private final @NotNull String symbol;
    private final boolean unary;

    Op(@NotNull String symbol, boolean unary) {
        this.symbol = symbol;
        this.unary = unary;
    }

    public @NotNull String symbol() {
        return symbol;
    }

    public boolean isUnary() {
        return unary;
    }
}
