package io.geekya215.interval.checked;

import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;

// Overflow yields the extreme of the result kind on the side of the true result.
public enum Saturate implements Hook {
    INSTANCE;

    @Override
    public @NotNull Scalar onBadCast(@NotNull NumericKind target, @NotNull Scalar src) {
        if (src.isNaN()) {
            return Scalar.wrap(target, BigInteger.ZERO);
        }
        if (CheckedMath.compare(src, target.min()) < 0) {
            return target.min();
        }
        if (CheckedMath.compare(src, target.max()) > 0) {
            return target.max();
        }
        // in range, so only precision is lost
        return src.castTo(target);
    }

    @Override
    public @NotNull Scalar onLowerBound(@NotNull Scalar rhs, @NotNull Scalar bound) {
        return bound;
    }

    @Override
    public @NotNull Scalar onUpperBound(@NotNull Scalar rhs, @NotNull Scalar bound) {
        return bound;
    }

    @Override
    public @NotNull Scalar onOverflow(@NotNull Op op, @NotNull Scalar operand) {
        return saturate(CheckedMath.resultKind(operand), CheckedMath.overflowSign(op, operand));
    }

    @Override
    public @NotNull Scalar onOverflow(@NotNull Op op, @NotNull Scalar lhs, @NotNull Scalar rhs) {
        return saturate(CheckedMath.resultKind(lhs, rhs), CheckedMath.overflowSign(op, lhs, rhs));
    }

    private static @NotNull Scalar saturate(@NotNull NumericKind kind, int sign) {
        if (sign > 0) {
            return kind.max();
        }
        if (sign < 0) {
            return kind.min();
        }
        return Scalar.wrap(kind, BigInteger.ZERO);
    }
}
