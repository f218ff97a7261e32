package io.geekya215.interval;

import io.geekya215.interval.checked.Checked;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

public sealed interface Bound permits Bound.Static, Bound.Dynamic {
    static @NotNull Static fixed(@NotNull Checked lower, @NotNull Checked upper) {
        return new Static(lower, upper);
    }

    static @NotNull Dynamic dynamic() {
        return new Dynamic();
    }

    final class Static implements Bound {
        private final @NotNull Checked lower;
        private final @NotNull Checked upper;
        private final boolean unitInterval;

        Static(@NotNull Checked lower, @NotNull Checked upper) {
            this.lower = Objects.requireNonNull(lower);
            this.upper = Objects.requireNonNull(upper);
            this.unitInterval = lower.compareTo(0) >= 0 && upper.compareTo(1) <= 0;
        }

        public @NotNull Checked lower() {
            return lower;
        }

        public @NotNull Checked upper() {
            return upper;
        }

        public boolean isUnitInterval() {
            return unitInterval;
        }

        @Override
        public String toString() {
            return "Static[" + lower + ", " + upper + "]";
        }
    }

    record Dynamic() implements Bound {
    }
}
