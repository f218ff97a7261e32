package io.geekya215.interval.exception;

public class IntervalInvariantError extends AssertionError {
    private static final String TEMPLATE = "Invalid interval boundaries: [%s, %s]";

    public IntervalInvariantError(Object start, Object end) {
        super(String.format(TEMPLATE, start, end));
    }

    public Violation violation() {
        return Violation.INTERVAL_INVARIANT;
    }
}
