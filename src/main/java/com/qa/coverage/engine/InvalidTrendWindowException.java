package com.qa.coverage.engine;

public class InvalidTrendWindowException extends CoverageEngineException {

    public InvalidTrendWindowException(int windowDays) {
        super("InvalidTrendWindow", "Trend window must be one of 7, 14 or 30 days, got " + windowDays);
    }
}
