package io.geekya215.interval.checked;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

public record CheckedType(@NotNull NumericKind kind, @NotNull Hook hook, @NotNull BoundedDomain domain) {
    public CheckedType {
        Objects.requireNonNull(kind);
        Objects.requireNonNull(hook);
        Objects.requireNonNull(domain);
        if (domain.kind() != kind) {
            throw new IllegalArgumentException("Domain of kind " + domain.kind() + " does not match " + kind);
        }
    }

    public static @NotNull CheckedType of(@NotNull NumericKind kind) {
        return of(kind, Abort.INSTANCE);
    }

    public static @NotNull CheckedType of(@NotNull NumericKind kind, @NotNull Hook hook) {
        return new CheckedType(kind, hook, BoundedDomain.natural(kind));
    }

    public @NotNull CheckedType withHook(@NotNull Hook hook) {
        return new CheckedType(kind, hook, domain);
    }

    public @NotNull CheckedType withDomain(@NotNull BoundedDomain domain) {
        return new CheckedType(kind, hook, domain);
    }

    public @NotNull CheckedType withDomain(long min, long max) {
        return withDomain(BoundedDomain.between(kind, min, max));
    }

    public @NotNull Checked checked(@NotNull Scalar value) {
        return Checked.store(this, value);
    }

    public @NotNull Checked checked(long value) {
        return checked(Scalar.of(value));
    }

    public @NotNull Checked checked(double value) {
        return checked(Scalar.ofDouble(value));
    }
}
