package io.geekya215.interval.checked;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;

// checked* operations return null when the exact result is not representable,
// wrapping* operations return what the JVM would produce.
public final class CheckedMath {
    private CheckedMath() {
    }

    public static @NotNull NumericKind resultKind(@NotNull Scalar operand) {
        return NumericKind.common(operand.kind(), operand.kind());
    }

    public static @NotNull NumericKind resultKind(@NotNull Scalar lhs, @NotNull Scalar rhs) {
        return NumericKind.common(lhs.kind(), rhs.kind());
    }

    public static @Nullable Scalar checkedBinary(@NotNull Op op, @NotNull Scalar lhs, @NotNull Scalar rhs) {
        NumericKind kind = resultKind(lhs, rhs);
        if (kind.isFloating()) {
            Scalar result = floating(op, kind, lhs, rhs);
            if (!result.isFinite() && lhs.isFinite() && rhs.isFinite()) {
                return null;
            }
            return result;
        }
        BigInteger exact = integral(op, lhs.toBigInteger(), rhs.toBigInteger());
        if (exact == null || !kind.fits(exact)) {
            return null;
        }
        return Scalar.wrap(kind, exact);
    }

    public static @NotNull Scalar wrappingBinary(@NotNull Op op, @NotNull Scalar lhs, @NotNull Scalar rhs) {
        NumericKind kind = resultKind(lhs, rhs);
        if (kind.isFloating()) {
            return floating(op, kind, lhs, rhs);
        }
        BigInteger exact = integral(op, lhs.toBigInteger(), rhs.toBigInteger());
        if (exact == null) {
            throw new ArithmeticException("/ by zero");
        }
        return Scalar.wrap(kind, exact);
    }

    public static @Nullable Scalar checkedUnary(@NotNull Op op, @NotNull Scalar operand) {
        NumericKind kind = resultKind(operand);
        if (op == Op.COMPLEMENT || kind.isFloating()) {
            return wrappingUnary(op, operand);
        }
        BigInteger exact = operand.toBigInteger().negate();
        return kind.fits(exact) ? Scalar.wrap(kind, exact) : null;
    }

    public static @NotNull Scalar wrappingUnary(@NotNull Op op, @NotNull Scalar operand) {
        NumericKind kind = resultKind(operand);
        return switch (op) {
            case NEGATE -> kind.isFloating()
                    ? Scalar.real(kind, -operand.doubleValue())
                    : Scalar.wrap(kind, operand.toBigInteger().negate());
            case COMPLEMENT -> {
                if (kind.isFloating()) {
                    throw new IllegalArgumentException("~ is undefined for " + kind);
                }
                yield Scalar.wrap(kind, operand.castTo(kind).toBigInteger().not());
            }
            default -> throw new IllegalArgumentException(op + " is not a unary operator");
        };
    }

    public static int overflowSign(@NotNull Op op, @NotNull Scalar lhs, @NotNull Scalar rhs) {
        NumericKind kind = resultKind(lhs, rhs);
        if (kind.isFloating()) {
            return floating(op, NumericKind.DOUBLE, lhs, rhs).signum();
        }
        BigInteger exact = integral(op, lhs.toBigInteger(), rhs.toBigInteger());
        return exact == null ? lhs.signum() : exact.signum();
    }

    public static int overflowSign(@NotNull Op op, @NotNull Scalar operand) {
        return op == Op.NEGATE ? -operand.signum() : 0;
    }

    public static @Nullable Scalar convert(@NotNull Scalar src, @NotNull NumericKind target) {
        if (src.kind() == target) {
            return src;
        }
        if (target.isIntegral()) {
            if (!src.isFinite()) {
                return null;
            }
            BigDecimal exact = src.toBigDecimal();
            if (exact.signum() != 0 && exact.stripTrailingZeros().scale() > 0) {
                return null;
            }
            BigInteger value = exact.toBigInteger();
            return target.fits(value) ? Scalar.wrap(target, value) : null;
        }
        if (!src.isFinite()) {
            return Scalar.real(target, src.doubleValue());
        }
        Scalar converted = src.castTo(target);
        if (!converted.isFinite()) {
            return null;
        }
        return converted.toBigDecimal().compareTo(src.toBigDecimal()) == 0 ? converted : null;
    }

    public static boolean isSignMismatch(@NotNull Scalar lhs, @NotNull Scalar rhs) {
        if (lhs.kind().isFloating() || rhs.kind().isFloating()) {
            return false;
        }
        if (lhs.kind().isSigned() == rhs.kind().isSigned()) {
            return false;
        }
        return lhs.isNegative() || rhs.isNegative();
    }

    public static boolean isUnordered(@NotNull Scalar lhs, @NotNull Scalar rhs) {
        return lhs.isNaN() || rhs.isNaN();
    }

    public static int compare(@NotNull Scalar lhs, @NotNull Scalar rhs) {
        if (lhs.isNaN() || rhs.isNaN()) {
            return Boolean.compare(lhs.isNaN(), rhs.isNaN());
        }
        if (lhs.isInfinite() || rhs.isInfinite()) {
            double l = lhs.doubleValue();
            double r = rhs.doubleValue();
            return l < r ? -1 : (l > r ? 1 : 0);
        }
        if (lhs.kind().isIntegral() && rhs.kind().isIntegral()) {
            return lhs.toBigInteger().compareTo(rhs.toBigInteger());
        }
        return lhs.toBigDecimal().compareTo(rhs.toBigDecimal());
    }

    public static boolean equal(@NotNull Scalar lhs, @NotNull Scalar rhs) {
        return !isUnordered(lhs, rhs) && compare(lhs, rhs) == 0;
    }

    private static @Nullable BigInteger integral(@NotNull Op op, @NotNull BigInteger l, @NotNull BigInteger r) {
        return switch (op) {
            case ADD -> l.add(r);
            case SUBTRACT -> l.subtract(r);
            case MULTIPLY -> l.multiply(r);
            // BigInteger division truncates toward zero like the JVM
            case DIVIDE -> r.signum() == 0 ? null : l.divide(r);
            case REMAINDER -> r.signum() == 0 ? null : l.remainder(r);
            default -> throw new IllegalArgumentException(op + " is not a binary operator");
        };
    }

    private static @NotNull Scalar floating(@NotNull Op op, @NotNull NumericKind kind,
                                            @NotNull Scalar lhs, @NotNull Scalar rhs) {
        double l = lhs.castTo(kind).doubleValue();
        double r = rhs.castTo(kind).doubleValue();
        double result = switch (op) {
            case ADD -> l + r;
            case SUBTRACT -> l - r;
            case MULTIPLY -> l * r;
            case DIVIDE -> l / r;
            case REMAINDER -> l % r;
            default -> throw new IllegalArgumentException(op + " is not a binary operator");
        };
        return Scalar.real(kind, result);
    }
}
