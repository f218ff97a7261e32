package io.geekya215.interval.checked;

import io.geekya215.interval.exception.ArithmeticAbortError;
import io.geekya215.interval.exception.Violation;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Logs every violation at ERROR and throws ArithmeticAbortError; no hook returns.
public enum Abort implements Hook {
    INSTANCE;

    private static final Logger logger = LoggerFactory.getLogger(Abort.class);

    @Override
    public @NotNull Scalar onBadCast(@NotNull NumericKind target, @NotNull Scalar src) {
        throw abort(Violation.BAD_CAST, Diagnostics.badCast(target, src));
    }

    @Override
    public @NotNull Scalar onLowerBound(@NotNull Scalar rhs, @NotNull Scalar bound) {
        throw abort(Violation.LOWER_BOUND, Diagnostics.lowerBound(rhs, bound));
    }

    @Override
    public @NotNull Scalar onUpperBound(@NotNull Scalar rhs, @NotNull Scalar bound) {
        throw abort(Violation.UPPER_BOUND, Diagnostics.upperBound(rhs, bound));
    }

    @Override
    public boolean hookOpEquals(@NotNull Scalar lhs, @NotNull Scalar rhs) {
        if (CheckedMath.isSignMismatch(lhs, rhs)) {
            throw abort(Violation.SIGN_MISMATCH_COMPARISON, Diagnostics.comparison("==", lhs, rhs));
        }
        return CheckedMath.equal(lhs, rhs);
    }

    @Override
    public int hookOpCmp(@NotNull Scalar lhs, @NotNull Scalar rhs) {
        if (CheckedMath.isSignMismatch(lhs, rhs) || CheckedMath.isUnordered(lhs, rhs)) {
            throw abort(Violation.SIGN_MISMATCH_COMPARISON, Diagnostics.comparison("<=>", lhs, rhs));
        }
        return CheckedMath.compare(lhs, rhs);
    }

    @Override
    public @NotNull Scalar onOverflow(@NotNull Op op, @NotNull Scalar operand) {
        throw abort(Violation.OVERFLOW, Diagnostics.overflow(op, operand));
    }

    @Override
    public @NotNull Scalar onOverflow(@NotNull Op op, @NotNull Scalar lhs, @NotNull Scalar rhs) {
        throw abort(Violation.OVERFLOW, Diagnostics.overflow(op, lhs, rhs));
    }

    private static @NotNull ArithmeticAbortError abort(@NotNull Violation violation, @NotNull String detail) {
        logger.error(detail);
        return new ArithmeticAbortError(violation, detail);
    }
}
