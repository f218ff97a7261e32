package io.geekya215.interval.checked;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

public final class Checked implements Comparable<Checked> {
    private final @NotNull CheckedType type;
    private final @NotNull Scalar value;

    private Checked(@NotNull CheckedType type, @NotNull Scalar value) {
        this.type = type;
        this.value = value;
    }

    public static @NotNull Checked of(int value) {
        return of(Scalar.of(value));
    }

    public static @NotNull Checked of(long value) {
        return of(Scalar.of(value));
    }

    public static @NotNull Checked of(double value) {
        return of(Scalar.ofDouble(value));
    }

    public static @NotNull Checked ofUnsigned(int bits) {
        return of(Scalar.ofUnsignedInt(bits));
    }

    public static @NotNull Checked ofUnsigned(long bits) {
        return of(Scalar.ofUnsignedLong(bits));
    }

    public static @NotNull Checked of(@NotNull Scalar value) {
        return CheckedType.of(value.kind()).checked(value);
    }

    static @NotNull Checked store(@NotNull CheckedType type, @NotNull Scalar value) {
        Objects.requireNonNull(value);
        Scalar converted = CheckedMath.convert(value, type.kind());
        if (converted == null) {
            converted = expectKind(type.hook().onBadCast(type.kind(), value), type.kind());
        }
        return new Checked(type, bounded(type, converted));
    }

    private static @NotNull Scalar bounded(@NotNull CheckedType type, @NotNull Scalar value) {
        if (value.isNaN()) {
            return value;
        }
        BoundedDomain domain = type.domain();
        if (CheckedMath.compare(value, domain.min()) < 0) {
            return expectKind(type.hook().onLowerBound(value, domain.min()), type.kind());
        }
        if (CheckedMath.compare(value, domain.max()) > 0) {
            return expectKind(type.hook().onUpperBound(value, domain.max()), type.kind());
        }
        return value;
    }

    private static @NotNull Scalar expectKind(@NotNull Scalar substitute, @NotNull NumericKind kind) {
        if (substitute.kind() != kind) {
            throw new IllegalStateException("Hook returned " + substitute.kind() + " where " + kind + " was expected");
        }
        return substitute;
    }

    public @NotNull CheckedType type() {
        return type;
    }

    public @NotNull NumericKind kind() {
        return type.kind();
    }

    public @NotNull Hook hook() {
        return type.hook();
    }

    public @NotNull Scalar get() {
        return value;
    }

    public long longValue() {
        return value.longValue();
    }

    public double doubleValue() {
        return value.doubleValue();
    }

    public @NotNull Checked to(@NotNull NumericKind target) {
        return CheckedType.of(target, type.hook()).checked(value);
    }

    public @NotNull Checked assign(@NotNull Checked rhs) {
        return store(type, rhs.value);
    }

    public @NotNull Checked assign(@NotNull Scalar rhs) {
        return store(type, rhs);
    }

    public @NotNull Checked apply(@NotNull Op op) {
        if (!op.isUnary()) {
            throw new IllegalArgumentException(op + " is not a unary operator");
        }
        Scalar result = CheckedMath.checkedUnary(op, value);
        if (result == null) {
            result = expectKind(type.hook().onOverflow(op, value), CheckedMath.resultKind(value));
        }
        return result(result);
    }

    public @NotNull Checked apply(@NotNull Op op, @NotNull Scalar rhs) {
        if (op.isUnary()) {
            throw new IllegalArgumentException(op + " is not a binary operator");
        }
        Scalar result = CheckedMath.checkedBinary(op, value, rhs);
        if (result == null) {
            result = expectKind(type.hook().onOverflow(op, value, rhs), CheckedMath.resultKind(value, rhs));
        }
        return result(result);
    }

    private @NotNull Checked result(@NotNull Scalar result) {
        // a promoted kind drops this domain for the natural one
        CheckedType resultType = result.kind() == type.kind() ? type : CheckedType.of(result.kind(), type.hook());
        return new Checked(resultType, bounded(resultType, result));
    }

    public @NotNull Checked negate() {
        return apply(Op.NEGATE);
    }

    public @NotNull Checked complement() {
        return apply(Op.COMPLEMENT);
    }

    public @NotNull Checked plus(@NotNull Checked rhs) {
        return apply(Op.ADD, rhs.value);
    }

    public @NotNull Checked plus(long rhs) {
        return apply(Op.ADD, Scalar.of(rhs));
    }

    public @NotNull Checked plus(int rhs) {
        return apply(Op.ADD, Scalar.of(rhs));
    }

    public @NotNull Checked minus(@NotNull Checked rhs) {
        return apply(Op.SUBTRACT, rhs.value);
    }

    public @NotNull Checked minus(int rhs) {
        return apply(Op.SUBTRACT, Scalar.of(rhs));
    }

    public @NotNull Checked times(@NotNull Checked rhs) {
        return apply(Op.MULTIPLY, rhs.value);
    }

    public @NotNull Checked times(int rhs) {
        return apply(Op.MULTIPLY, Scalar.of(rhs));
    }

    public @NotNull Checked dividedBy(@NotNull Checked rhs) {
        return apply(Op.DIVIDE, rhs.value);
    }

    public @NotNull Checked dividedBy(int rhs) {
        return apply(Op.DIVIDE, Scalar.of(rhs));
    }

    public @NotNull Checked remainder(@NotNull Checked rhs) {
        return apply(Op.REMAINDER, rhs.value);
    }

    public boolean isEqualTo(@NotNull Checked rhs) {
        return isEqualTo(rhs.value);
    }

    public boolean isEqualTo(@NotNull Scalar rhs) {
        return type.hook().hookOpEquals(value, rhs);
    }

    public boolean isEqualTo(long rhs) {
        return isEqualTo(Scalar.of(rhs));
    }

    @Override
    public int compareTo(@NotNull Checked rhs) {
        return compareTo(rhs.value);
    }

    public int compareTo(@NotNull Scalar rhs) {
        return type.hook().hookOpCmp(value, rhs);
    }

    public int compareTo(int rhs) {
        return compareTo(Scalar.of(rhs));
    }

    public boolean isLessThan(@NotNull Checked rhs) {
        return compareTo(rhs) < 0;
    }

    public boolean isLessThanOrEqualTo(@NotNull Checked rhs) {
        return compareTo(rhs) <= 0;
    }

    public boolean isGreaterThan(@NotNull Checked rhs) {
        return compareTo(rhs) > 0;
    }

    public boolean isGreaterThanOrEqualTo(@NotNull Checked rhs) {
        return compareTo(rhs) >= 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Checked)) return false;
        return isEqualTo((Checked) o);
    }

    @Override
    public int hashCode() {
        if (!value.isFinite()) {
            return Double.hashCode(value.doubleValue());
        }
        return value.toBigDecimal().stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
