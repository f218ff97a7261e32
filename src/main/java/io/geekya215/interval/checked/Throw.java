package io.geekya215.interval.checked;

import io.geekya215.interval.exception.CheckFailure;
import io.geekya215.interval.exception.Violation;
import org.jetbrains.annotations.NotNull;

public enum Throw implements Hook {
    INSTANCE;

    @Override
    public @NotNull Scalar onBadCast(@NotNull NumericKind target, @NotNull Scalar src) {
        throw new CheckFailure(Violation.BAD_CAST, Diagnostics.badCast(target, src));
    }

    @Override
    public @NotNull Scalar onLowerBound(@NotNull Scalar rhs, @NotNull Scalar bound) {
        throw new CheckFailure(Violation.LOWER_BOUND, Diagnostics.lowerBound(rhs, bound));
    }

    @Override
    public @NotNull Scalar onUpperBound(@NotNull Scalar rhs, @NotNull Scalar bound) {
        throw new CheckFailure(Violation.UPPER_BOUND, Diagnostics.upperBound(rhs, bound));
    }

    @Override
    public boolean hookOpEquals(@NotNull Scalar lhs, @NotNull Scalar rhs) {
        if (CheckedMath.isSignMismatch(lhs, rhs)) {
            throw new CheckFailure(Violation.SIGN_MISMATCH_COMPARISON, Diagnostics.comparison("==", lhs, rhs));
        }
        return CheckedMath.equal(lhs, rhs);
    }

    @Override
    public int hookOpCmp(@NotNull Scalar lhs, @NotNull Scalar rhs) {
        if (CheckedMath.isSignMismatch(lhs, rhs) || CheckedMath.isUnordered(lhs, rhs)) {
            throw new CheckFailure(Violation.SIGN_MISMATCH_COMPARISON, Diagnostics.comparison("<=>", lhs, rhs));
        }
        return CheckedMath.compare(lhs, rhs);
    }

    @Override
    public @NotNull Scalar onOverflow(@NotNull Op op, @NotNull Scalar operand) {
        throw new CheckFailure(Violation.OVERFLOW, Diagnostics.overflow(op, operand));
    }

    @Override
    public @NotNull Scalar onOverflow(@NotNull Op op, @NotNull Scalar lhs, @NotNull Scalar rhs) {
        throw new CheckFailure(Violation.OVERFLOW, Diagnostics.overflow(op, lhs, rhs));
    }
}
