package com.qa.coverage.engine;

/**
 * Decides between a manual and an automated event that carry exactly the same effective time.
 */
public enum SourceTiePolicy {

    /** The manual execution wins; an automated run has to be strictly later to take over. */
    MANUAL_WINS,

    /** The automated run wins. */
    AUTOMATED_WINS;

    int rank(EventSource source) {
        if (source == EventSource.MANUAL) {
            return this == MANUAL_WINS ? 1 : 0;
        }
        return this == MANUAL_WINS ? 0 : 1;
    }
}
