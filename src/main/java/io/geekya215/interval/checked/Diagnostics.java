package io.geekya215.interval.checked;

import org.jetbrains.annotations.NotNull;

import java.util.Locale;

final class Diagnostics {
    private Diagnostics() {
    }

    static @NotNull String badCast(@NotNull NumericKind target, @NotNull Scalar src) {
        return String.format("Erroneous cast: cast(%s) %s", name(target), describe(src));
    }

    static @NotNull String lowerBound(@NotNull Scalar rhs, @NotNull Scalar bound) {
        return String.format("Lower bound error: %s < %s", describe(rhs), describe(bound));
    }

    static @NotNull String upperBound(@NotNull Scalar rhs, @NotNull Scalar bound) {
        return String.format("Upper bound error: %s > %s", describe(rhs), describe(bound));
    }

    static @NotNull String comparison(@NotNull String symbol, @NotNull Scalar lhs, @NotNull Scalar rhs) {
        return String.format("Erroneous comparison: %s %s %s", describe(lhs), symbol, describe(rhs));
    }

    static @NotNull String overflow(@NotNull Op op, @NotNull Scalar operand) {
        return String.format("Overflow on unary operator: %s%s", op.symbol(), describe(operand));
    }

    static @NotNull String overflow(@NotNull Op op, @NotNull Scalar lhs, @NotNull Scalar rhs) {
        return String.format("Overflow on binary operator: %s %s %s", describe(lhs), op.symbol(), describe(rhs));
    }

    static @NotNull String describe(@NotNull Scalar value) {
        return name(value.kind()) + "(" + value + ")";
    }

    private static @NotNull String name(@NotNull NumericKind kind) {
        return kind.name().toLowerCase(Locale.ROOT);
    }
}
