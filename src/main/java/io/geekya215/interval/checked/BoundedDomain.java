package io.geekya215.interval.checked;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

public record BoundedDomain(@NotNull Scalar min, @NotNull Scalar max) {
    public BoundedDomain {
        Objects.requireNonNull(min);
        Objects.requireNonNull(max);
        if (min.kind() != max.kind()) {
            throw new IllegalArgumentException("Domain bounds differ in kind: " + min.kind() + " and " + max.kind());
        }
        if (min.isNaN() || max.isNaN()) {
            throw new IllegalArgumentException("Domain bounds must not be NaN");
        }
        if (CheckedMath.compare(min, max) > 0) {
            throw new IllegalArgumentException("Domain minimum " + min + " exceeds maximum " + max);
        }
    }

    public static @NotNull BoundedDomain natural(@NotNull NumericKind kind) {
        return new BoundedDomain(kind.min(), kind.max());
    }

    public static @NotNull BoundedDomain between(@NotNull NumericKind kind, @NotNull Scalar min, @NotNull Scalar max) {
        return new BoundedDomain(exactly(kind, min), exactly(kind, max));
    }

    public static @NotNull BoundedDomain between(@NotNull NumericKind kind, long min, long max) {
        return between(kind, Scalar.of(min), Scalar.of(max));
    }

    public @NotNull NumericKind kind() {
        return min.kind();
    }

    public boolean contains(@NotNull Scalar value) {
        return CheckedMath.compare(min, value) <= 0 && CheckedMath.compare(value, max) <= 0;
    }

    private static @NotNull Scalar exactly(@NotNull NumericKind kind, @NotNull Scalar value) {
        Scalar converted = CheckedMath.convert(value, kind);
        if (converted == null) {
            throw new IllegalArgumentException(value + " is not representable as " + kind);
        }
        return converted;
    }
}
