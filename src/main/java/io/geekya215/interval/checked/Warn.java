package io.geekya215.interval.checked;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Logs at WARN and continues with the JVM result: overflow wraps, casts truncate,
// bounds pin. Integral division by zero still throws ArithmeticException.
public enum Warn implements Hook {
    INSTANCE;

    private static final Logger logger = LoggerFactory.getLogger(Warn.class);

    @Override
    public @NotNull Scalar onBadCast(@NotNull NumericKind target, @NotNull Scalar src) {
        logger.warn(Diagnostics.badCast(target, src));
        return src.castTo(target);
    }

    @Override
    public @NotNull Scalar onLowerBound(@NotNull Scalar rhs, @NotNull Scalar bound) {
        logger.warn(Diagnostics.lowerBound(rhs, bound));
        return bound;
    }

    @Override
    public @NotNull Scalar onUpperBound(@NotNull Scalar rhs, @NotNull Scalar bound) {
        logger.warn(Diagnostics.upperBound(rhs, bound));
        return bound;
    }

    @Override
    public boolean hookOpEquals(@NotNull Scalar lhs, @NotNull Scalar rhs) {
        if (CheckedMath.isSignMismatch(lhs, rhs)) {
            logger.warn(Diagnostics.comparison("==", lhs, rhs));
        }
        return CheckedMath.equal(lhs, rhs);
    }

    @Override
    public int hookOpCmp(@NotNull Scalar lhs, @NotNull Scalar rhs) {
        if (CheckedMath.isSignMismatch(lhs, rhs) || CheckedMath.isUnordered(lhs, rhs)) {
            logger.warn(Diagnostics.comparison("<=>", lhs, rhs));
        }
        return CheckedMath.compare(lhs, rhs);
    }

    @Override
    public @NotNull Scalar onOverflow(@NotNull Op op, @NotNull Scalar operand) {
        logger.warn(Diagnostics.overflow(op, operand));
        return CheckedMath.wrappingUnary(op, operand);
    }

    @Override
    public @NotNull Scalar onOverflow(@NotNull Op op, @NotNull Scalar lhs, @NotNull Scalar rhs) {
        logger.warn(Diagnostics.overflow(op, lhs, rhs));
        return CheckedMath.wrappingBinary(op, lhs, rhs);
    }
}
