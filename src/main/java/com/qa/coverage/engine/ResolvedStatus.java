package com.qa.coverage.engine;

import java.time.Instant;
import java.util.Objects;

/**
 * Effective status of one test case as of a cutoff. Always recomputed from the events, never stored.
 */
public final class ResolvedStatus {

    private final Long testCaseId;
    private final ExecutionResult result;
    private final EventSource source;
    private final Instant asOf;
    private final Instant effectiveTime;

    public ResolvedStatus(Long testCaseId, ExecutionResult result, EventSource source, Instant asOf,
                          Instant effectiveTime) {
        this.testCaseId = testCaseId;
        this.result = Objects.requireNonNull(result, "result");
        this.source = Objects.requireNonNull(source, "source");
        this.asOf = asOf;
        this.effectiveTime = effectiveTime;
    }

    public static ResolvedStatus notExecuted(Long testCaseId, Instant asOf) {
        return new ResolvedStatus(testCaseId, ExecutionResult.NOT_EXECUTED, EventSource.NONE, asOf, null);
    }

    public static ResolvedStatus of(StatusEvent event, Instant asOf) {
        return new ResolvedStatus(event.getTestCaseId(), event.getResult(), event.getSource(), asOf,
                event.getEffectiveTime());
    }

    public Long getTestCaseId() {
        return testCaseId;
    }

    public ExecutionResult getResult() {
        return result;
    }

    public EventSource getSource() {
        return source;
    }

    public Instant getAsOf() {
        return asOf;
    }

    /** Effective time of the winning event, null when not executed. */
    public Instant getEffectiveTime() {
        return effectiveTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResolvedStatus)) {
            return false;
        }
        ResolvedStatus that = (ResolvedStatus) o;
        return Objects.equals(testCaseId, that.testCaseId)
                && result == that.result
                && source == that.source
                && Objects.equals(asOf, that.asOf)
                && Objects.equals(effectiveTime, that.effectiveTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(testCaseId, result, source, asOf, effectiveTime);
    }

    @Override
    public String toString() {
        return "ResolvedStatus{tc=" + testCaseId + ", " + result + " via " + source + ", asOf=" + asOf + "}";
    }
}
