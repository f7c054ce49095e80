package com.qa.coverage.engine;

public final class Percentages {

    private Percentages() {
    }

    /** round(100 * numerator / denominator), 0 when the denominator is 0. */
    public static int of(long numerator, long denominator) {
        if (denominator == 0) {
            return 0;
        }
        return (int) Math.round(100.0 * numerator / denominator);
    }
}
