package io.geekya215.interval.checked;

import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Objects;

// Integral payloads live in bits (unsigned zero-extended, ULONG raw), floating ones in real.
public final class Scalar {
    private static final BigInteger TWO_TO_64 = BigInteger.ONE.shiftLeft(64);

    private final @NotNull NumericKind kind;
    private final long bits;
    private final double real;

    private Scalar(@NotNull NumericKind kind, long bits, double real) {
        this.kind = kind;
        this.bits = bits;
        this.real = real;
    }

    public static @NotNull Scalar ofByte(byte value) {
        return new Scalar(NumericKind.BYTE, value, 0.0);
    }

    public static @NotNull Scalar ofShort(short value) {
        return new Scalar(NumericKind.SHORT, value, 0.0);
    }

    public static @NotNull Scalar of(int value) {
        return new Scalar(NumericKind.INT, value, 0.0);
    }

    public static @NotNull Scalar of(long value) {
        return new Scalar(NumericKind.LONG, value, 0.0);
    }

    public static @NotNull Scalar ofUnsignedByte(byte bits) {
        return new Scalar(NumericKind.UBYTE, Byte.toUnsignedLong(bits), 0.0);
    }

    public static @NotNull Scalar ofUnsignedShort(short bits) {
        return new Scalar(NumericKind.USHORT, Short.toUnsignedLong(bits), 0.0);
    }

    public static @NotNull Scalar ofUnsignedInt(int bits) {
        return new Scalar(NumericKind.UINT, Integer.toUnsignedLong(bits), 0.0);
    }

    public static @NotNull Scalar ofUnsignedLong(long bits) {
        return new Scalar(NumericKind.ULONG, bits, 0.0);
    }

    public static @NotNull Scalar ofFloat(float value) {
        return new Scalar(NumericKind.FLOAT, 0L, value);
    }

    public static @NotNull Scalar ofDouble(double value) {
        return new Scalar(NumericKind.DOUBLE, 0L, value);
    }

    public static @NotNull Scalar wrap(@NotNull NumericKind kind, @NotNull BigInteger value) {
        long low = value.longValue();
        return switch (kind) {
            case BYTE -> new Scalar(kind, (byte) low, 0.0);
            case UBYTE -> new Scalar(kind, low & 0xFFL, 0.0);
            case SHORT -> new Scalar(kind, (short) low, 0.0);
            case USHORT -> new Scalar(kind, low & 0xFFFFL, 0.0);
            case INT -> new Scalar(kind, (int) low, 0.0);
            case UINT -> new Scalar(kind, low & 0xFFFFFFFFL, 0.0);
            case LONG, ULONG -> new Scalar(kind, low, 0.0);
            case FLOAT -> ofFloat(value.floatValue());
            case DOUBLE -> ofDouble(value.doubleValue());
        };
    }

    static @NotNull Scalar real(@NotNull NumericKind kind, double value) {
        return kind == NumericKind.FLOAT ? ofFloat((float) value) : ofDouble(value);
    }

    public @NotNull NumericKind kind() {
        return kind;
    }

    public boolean isNaN() {
        return kind.isFloating() && Double.isNaN(real);
    }

    public boolean isInfinite() {
        return kind.isFloating() && Double.isInfinite(real);
    }

    public boolean isFinite() {
        return kind.isIntegral() || Double.isFinite(real);
    }

    public boolean isNegative() {
        if (kind.isFloating()) {
            return real < 0.0;
        }
        return kind.isSigned() && bits < 0;
    }

    public int signum() {
        if (kind.isFloating()) {
            return Double.isNaN(real) ? 0 : (int) Math.signum(real);
        }
        if (kind == NumericKind.ULONG) {
            return bits == 0 ? 0 : 1;
        }
        return Long.signum(bits);
    }

    public long longValue() {
        return kind.isFloating() ? (long) real : bits;
    }

    public double doubleValue() {
        if (kind.isFloating()) {
            return real;
        }
        if (kind == NumericKind.ULONG && bits < 0) {
            return toBigInteger().doubleValue();
        }
        return bits;
    }

    public float floatValue() {
        if (kind == NumericKind.FLOAT) {
            return (float) real;
        }
        if (kind.isIntegral()) {
            return kind == NumericKind.ULONG && bits < 0 ? toBigInteger().floatValue() : (float) bits;
        }
        return (float) real;
    }

    public @NotNull BigInteger toBigInteger() {
        if (kind.isFloating()) {
            return toBigDecimal().setScale(0, RoundingMode.DOWN).toBigIntegerExact();
        }
        BigInteger value = BigInteger.valueOf(bits);
        return kind == NumericKind.ULONG && bits < 0 ? value.add(TWO_TO_64) : value;
    }

    public @NotNull BigDecimal toBigDecimal() {
        if (kind.isIntegral()) {
            return new BigDecimal(toBigInteger());
        }
        if (!Double.isFinite(real)) {
            throw new ArithmeticException(this + " has no exact decimal value");
        }
        return new BigDecimal(real);
    }

    public @NotNull Scalar castTo(@NotNull NumericKind target) {
        if (target == kind) {
            return this;
        }
        if (target.isFloating()) {
            if (kind.isFloating()) {
                return real(target, real);
            }
            return target == NumericKind.FLOAT ? ofFloat(floatValue()) : ofDouble(doubleValue());
        }
        if (kind.isFloating()) {
            if (Double.isNaN(real)) {
                return wrap(target, BigInteger.ZERO);
            }
            if (Double.isInfinite(real)) {
                return real > 0 ? target.max() : target.min();
            }
        }
        return wrap(target, toBigInteger());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Scalar scalar = (Scalar) o;

        return kind == scalar.kind && bits == scalar.bits && Double.compare(real, scalar.real) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, bits, real);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case FLOAT -> Float.toString((float) real);
            case DOUBLE -> Double.toString(real);
            default -> toBigInteger().toString();
        };
    }
}
