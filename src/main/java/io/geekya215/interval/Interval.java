package io.geekya215.interval;

import io.geekya215.interval.checked.Checked;
import io.geekya215.interval.checked.CheckedMath;
import io.geekya215.interval.checked.Op;
import io.geekya215.interval.checked.Scalar;
import io.geekya215.interval.exception.IntervalInvariantError;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

// start <= end is checked after every constructor and compound assignment, under any policy.
// Bounds are never reordered, so a negative multiplier breaks the invariant.
public final class Interval {
    private static final Logger logger = LoggerFactory.getLogger(Interval.class);

    private @NotNull Bound bound;
    private @NotNull Checked start;
    private @NotNull Checked end;
    // memoized unit test for dynamic bounds, reset on mutation
    private @Nullable Boolean unitInterval;

    public Interval(@NotNull Checked start, @NotNull Checked end) {
        this(Bound.dynamic(), start, end);
    }

    public Interval(@NotNull Bound bound, @NotNull Checked start, @NotNull Checked end) {
        this.bound = Objects.requireNonNull(bound);
        this.start = Objects.requireNonNull(start);
        this.end = Objects.requireNonNull(end);
        checkInvariant();
        if (bound instanceof Bound.Static fixed && fixed.isUnitInterval() != holdsUnitValues()) {
            throw new IllegalArgumentException("Bounds " + this + " contradict declared " + fixed);
        }
    }

    public Interval(@NotNull Interval other) {
        this(other.bound, other.start, other.end);
    }

    public static @NotNull Interval of(@NotNull Checked start, @NotNull Checked end) {
        return new Interval(start, end);
    }

    public static @NotNull Interval declare(@NotNull Checked lower, @NotNull Checked upper) {
        return new Interval(Bound.fixed(lower, upper), lower, upper);
    }

    public @NotNull Checked start() {
        return start;
    }

    public @NotNull Checked end() {
        return end;
    }

    public @NotNull Bound bound() {
        return bound;
    }

    public boolean isUnitInterval() {
        if (bound instanceof Bound.Static fixed) {
            return fixed.isUnitInterval();
        }
        if (unitInterval == null) {
            unitInterval = holdsUnitValues();
        }
        return unitInterval;
    }

    private boolean holdsUnitValues() {
        return start.compareTo(0) >= 0 && end.compareTo(1) <= 0;
    }

    // declared bounds only describe intervals still holding exactly those values
    private @NotNull Bound boundFor(@NotNull Checked newStart, @NotNull Checked newEnd) {
        if (bound instanceof Bound.Static fixed
                && CheckedMath.equal(newStart.get(), fixed.lower().get())
                && CheckedMath.equal(newEnd.get(), fixed.upper().get())) {
            return bound;
        }
        return Bound.dynamic();
    }

    public @NotNull Interval plus(int rhs) {
        return apply(Op.ADD, Scalar.of(rhs));
    }

    public @NotNull Interval plus(long rhs) {
        return apply(Op.ADD, Scalar.of(rhs));
    }

    public @NotNull Interval plus(double rhs) {
        return apply(Op.ADD, Scalar.ofDouble(rhs));
    }

    public @NotNull Interval plus(@NotNull Scalar rhs) {
        return apply(Op.ADD, rhs);
    }

    public @NotNull Interval minus(int rhs) {
        return apply(Op.SUBTRACT, Scalar.of(rhs));
    }

    public @NotNull Interval minus(long rhs) {
        return apply(Op.SUBTRACT, Scalar.of(rhs));
    }

    public @NotNull Interval minus(double rhs) {
        return apply(Op.SUBTRACT, Scalar.ofDouble(rhs));
    }

    public @NotNull Interval minus(@NotNull Scalar rhs) {
        return apply(Op.SUBTRACT, rhs);
    }

    public @NotNull Interval times(int rhs) {
        return apply(Op.MULTIPLY, Scalar.of(rhs));
    }

    public @NotNull Interval times(long rhs) {
        return apply(Op.MULTIPLY, Scalar.of(rhs));
    }

    public @NotNull Interval times(double rhs) {
        return apply(Op.MULTIPLY, Scalar.ofDouble(rhs));
    }

    public @NotNull Interval times(@NotNull Scalar rhs) {
        return apply(Op.MULTIPLY, rhs);
    }

    public @NotNull Interval dividedBy(int rhs) {
        return apply(Op.DIVIDE, Scalar.of(rhs));
    }

    public @NotNull Interval dividedBy(long rhs) {
        return apply(Op.DIVIDE, Scalar.of(rhs));
    }

    public @NotNull Interval dividedBy(double rhs) {
        return apply(Op.DIVIDE, Scalar.ofDouble(rhs));
    }

    public @NotNull Interval dividedBy(@NotNull Scalar rhs) {
        return apply(Op.DIVIDE, rhs);
    }

    public @NotNull Interval remainder(int rhs) {
        return apply(Op.REMAINDER, Scalar.of(rhs));
    }

    public @NotNull Interval remainder(long rhs) {
        return apply(Op.REMAINDER, Scalar.of(rhs));
    }

    public @NotNull Interval remainder(@NotNull Scalar rhs) {
        return apply(Op.REMAINDER, rhs);
    }

    public @NotNull Interval addAssign(int rhs) {
        return applyAssign(Op.ADD, Scalar.of(rhs));
    }

    public @NotNull Interval addAssign(long rhs) {
        return applyAssign(Op.ADD, Scalar.of(rhs));
    }

    public @NotNull Interval addAssign(double rhs) {
        return applyAssign(Op.ADD, Scalar.ofDouble(rhs));
    }

    public @NotNull Interval addAssign(@NotNull Scalar rhs) {
        return applyAssign(Op.ADD, rhs);
    }

    public @NotNull Interval subtractAssign(int rhs) {
        return applyAssign(Op.SUBTRACT, Scalar.of(rhs));
    }

    public @NotNull Interval subtractAssign(long rhs) {
        return applyAssign(Op.SUBTRACT, Scalar.of(rhs));
    }

    public @NotNull Interval subtractAssign(double rhs) {
        return applyAssign(Op.SUBTRACT, Scalar.ofDouble(rhs));
    }

    public @NotNull Interval subtractAssign(@NotNull Scalar rhs) {
        return applyAssign(Op.SUBTRACT, rhs);
    }

    public @NotNull Interval multiplyAssign(int rhs) {
        return applyAssign(Op.MULTIPLY, Scalar.of(rhs));
    }

    public @NotNull Interval multiplyAssign(long rhs) {
        return applyAssign(Op.MULTIPLY, Scalar.of(rhs));
    }

    public @NotNull Interval multiplyAssign(double rhs) {
        return applyAssign(Op.MULTIPLY, Scalar.ofDouble(rhs));
    }

    public @NotNull Interval multiplyAssign(@NotNull Scalar rhs) {
        return applyAssign(Op.MULTIPLY, rhs);
    }

    public @NotNull Interval divideAssign(int rhs) {
        return applyAssign(Op.DIVIDE, Scalar.of(rhs));
    }

    public @NotNull Interval divideAssign(long rhs) {
        return applyAssign(Op.DIVIDE, Scalar.of(rhs));
    }

    public @NotNull Interval divideAssign(double rhs) {
        return applyAssign(Op.DIVIDE, Scalar.ofDouble(rhs));
    }

    public @NotNull Interval divideAssign(@NotNull Scalar rhs) {
        return applyAssign(Op.DIVIDE, rhs);
    }

    public @NotNull Interval remainderAssign(int rhs) {
        return applyAssign(Op.REMAINDER, Scalar.of(rhs));
    }

    public @NotNull Interval remainderAssign(long rhs) {
        return applyAssign(Op.REMAINDER, Scalar.of(rhs));
    }

    public @NotNull Interval remainderAssign(@NotNull Scalar rhs) {
        return applyAssign(Op.REMAINDER, rhs);
    }

    private @NotNull Interval apply(@NotNull Op op, @NotNull Scalar rhs) {
        boolean rescale = rescales(op);
        Checked newStart = step(start, op, rhs, rescale);
        Checked newEnd = step(end, op, rhs, rescale);
        return new Interval(boundFor(newStart, newEnd), newStart, newEnd);
    }

    private @NotNull Interval applyAssign(@NotNull Op op, @NotNull Scalar rhs) {
        boolean rescale = rescales(op);
        Checked newStart = step(start, op, rhs, rescale);
        Checked newEnd = step(end, op, rhs, rescale);
        bound = boundFor(newStart, newEnd);
        start = newStart;
        end = newEnd;
        unitInterval = null;
        checkInvariant();
        return this;
    }

    private boolean rescales(@NotNull Op op) {
        return op == Op.MULTIPLY && isUnitInterval();
    }

    private static @NotNull Checked step(@NotNull Checked value, @NotNull Op op, @NotNull Scalar rhs, boolean rescale) {
        if (rescale) {
            Scalar product = CheckedMath.checkedBinary(op, value.get(), rhs);
            if (product == null) {
                product = value.hook().onOverflow(op, value.get(), rhs);
            }
            return value.type().checked(product);
        }
        return value.assign(value.apply(op, rhs));
    }

    private void checkInvariant() {
        if (!start.isLessThanOrEqualTo(end)) {
            logger.error("Invalid interval boundaries: [{}, {}]", start, end);
            throw new IntervalInvariantError(start, end);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Interval)) return false;

        Interval other = (Interval) o;

        return start.isEqualTo(other.start) && end.isEqualTo(other.end);
    }

    @Override
    public int hashCode() {
        return 31 * start.hashCode() + end.hashCode();
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
