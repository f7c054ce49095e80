package com.qa.coverage.engine;

import java.util.Locale;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;

public enum ExecutionResult {

    PASSED,
    FAILED,
    BLOCKED,
    SKIPPED,
    /** No event at or before the cutoff. Never carried by a {@link StatusEvent}. */
    NOT_EXECUTED;

    /**
     * Parses a raw result string as written by the execution log or the automation directory.
     * "error" is how automation runs report a crashed script and is treated as a failure.
     */
    public static Optional<ExecutionResult> fromRaw(String raw) {
        if (StringUtils.isBlank(raw)) {
            return Optional.empty();
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "passed":
            case "pass":
                return Optional.of(PASSED);
            case "failed":
            case "fail":
            case "error":
                return Optional.of(FAILED);
            case "blocked":
                return Optional.of(BLOCKED);
            case "skipped":
                return Optional.of(SKIPPED);
            default:
                return Optional.empty();
        }
    }

    /** Skipped and not-executed both count as "not meaningfully executed" in every aggregate. */
    public boolean isMeaningfullyExecuted() {
        return this == PASSED || this == FAILED || this == BLOCKED;
    }
}
