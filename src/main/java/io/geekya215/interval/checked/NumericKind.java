package io.geekya215.interval.checked;

import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;

public enum NumericKind {
    BYTE(8, true, false),
    UBYTE(8, false, false),
    SHORT(16, true, false),
    USHORT(16, false, false),
    INT(32, true, false),
    UINT(32, false, false),
    LONG(64, true, false),
    ULONG(64, false, false),
    FLOAT(32, true, true),
    DOUBLE(64, true, true);

    private final int bits;
    private final boolean signed;
    private final boolean floating;

    NumericKind(int bits, boolean signed, boolean floating) {
        this.bits = bits;
        this.signed = signed;
        this.floating = floating;
    }

    public int bits() {
        return bits;
    }

    public boolean isSigned() {
        return signed;
    }

    public boolean isUnsigned() {
        return !signed;
    }

    public boolean isFloating() {
        return floating;
    }

    public boolean isIntegral() {
        return !floating;
    }

    public @NotNull BigInteger minInteger() {
        requireIntegral();
        return signed ? BigInteger.ONE.shiftLeft(bits - 1).negate() : BigInteger.ZERO;
    }

    public @NotNull BigInteger maxInteger() {
        requireIntegral();
        return BigInteger.ONE.shiftLeft(signed ? bits - 1 : bits).subtract(BigInteger.ONE);
    }

    public boolean fits(@NotNull BigInteger value) {
        return value.compareTo(minInteger()) >= 0 && value.compareTo(maxInteger()) <= 0;
    }

    public @NotNull Scalar min() {
        return switch (this) {
            case FLOAT -> Scalar.ofFloat(-Float.MAX_VALUE);
            case DOUBLE -> Scalar.ofDouble(-Double.MAX_VALUE);
            default -> Scalar.wrap(this, minInteger());
        };
    }

    public @NotNull Scalar max() {
        return switch (this) {
            case FLOAT -> Scalar.ofFloat(Float.MAX_VALUE);
            case DOUBLE -> Scalar.ofDouble(Double.MAX_VALUE);
            default -> Scalar.wrap(this, maxInteger());
        };
    }

    public static @NotNull NumericKind common(@NotNull NumericKind lhs, @NotNull NumericKind rhs) {
        if (lhs == DOUBLE || rhs == DOUBLE) {
            return DOUBLE;
        }
        if (lhs == FLOAT || rhs == FLOAT) {
            return FLOAT;
        }
        NumericKind l = lhs.promoted();
        NumericKind r = rhs.promoted();
        if (l.signed == r.signed) {
            return l.bits >= r.bits ? l : r;
        }
        NumericKind unsigned = l.signed ? r : l;
        NumericKind signed = l.signed ? l : r;
        return unsigned.bits >= signed.bits ? unsigned : signed;
    }

    private @NotNull NumericKind promoted() {
        return floating || bits >= 32 ? this : INT;
    }

    private void requireIntegral() {
        if (floating) {
            throw new UnsupportedOperationException(this + " is not an integral kind");
        }
    }
}
