package io.geekya215.interval.checked;

import org.jetbrains.annotations.NotNull;

// Consulted whenever an operation would be unsafe. A hook either returns a substitute
// of the kind the operation was producing, or throws. Substitutes of any other kind are
// rejected with IllegalStateException.
public interface Hook {
    @NotNull Scalar onBadCast(@NotNull NumericKind target, @NotNull Scalar src);

    @NotNull Scalar onLowerBound(@NotNull Scalar rhs, @NotNull Scalar bound);

    @NotNull Scalar onUpperBound(@NotNull Scalar rhs, @NotNull Scalar bound);

    default boolean hookOpEquals(@NotNull Scalar lhs, @NotNull Scalar rhs) {
        return CheckedMath.equal(lhs, rhs);
    }

    default int hookOpCmp(@NotNull Scalar lhs, @NotNull Scalar rhs) {
        return CheckedMath.compare(lhs, rhs);
    }

    @NotNull Scalar onOverflow(@NotNull Op op, @NotNull Scalar operand);

    @NotNull Scalar onOverflow(@NotNull Op op, @NotNull Scalar lhs, @NotNull Scalar rhs);
}
