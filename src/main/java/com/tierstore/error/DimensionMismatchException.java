package com.tierstore.error;

import java.util.Map;

public class DimensionMismatchException extends TierStoreException {
    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual, String subject) {
        super(ErrorCode.DIMENSION_MISMATCH,
                "Dense vector dimension mismatch for " + subject + ": expected " + expected + ", got " + actual,
                Map.of("expected", expected, "actual", actual, "subject", subject));
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
