package io.geekya215.interval.exception;

public enum Violation {
    BAD_CAST,
    LOWER_BOUND,
    UPPER_BOUND,
    SIGN_MISMATCH_COMPARISON,
    OVERFLOW,
    INTERVAL_INVARIANT
}
