package com.qa.coverage.engine;

import java.time.Instant;

public class InvalidCutoffException extends CoverageEngineException {

    public InvalidCutoffException(String message) {
        super("InvalidCutoff", message);
    }

    public InvalidCutoffException(String message, Throwable cause) {
        super("InvalidCutoff", message, cause);
    }

    public static Instant requireValid(Instant cutoff) {
        if (cutoff == null) {
            throw new InvalidCutoffException("Cutoff is required");
        }
        if (cutoff.isBefore(Instant.EPOCH)) {
            throw new InvalidCutoffException("Cutoff " + cutoff + " is before the epoch");
        }
        return cutoff;
    }
}
