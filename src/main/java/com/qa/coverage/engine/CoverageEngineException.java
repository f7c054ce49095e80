package com.qa.coverage.engine;

/**
 * Structural problem with a request to the engine. Never raised for missing or malformed data,
 * which degrades instead.
 */
public class CoverageEngineException extends RuntimeException {

    private final String errorType;

    public CoverageEngineException(String errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public CoverageEngineException(String errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public String getErrorType() {
        return errorType;
    }
}
