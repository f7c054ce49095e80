package com.qa.coverage.engine;

import java.time.Instant;
import java.util.Objects;

/**
 * Canonical status event for one test case, derived either from a manual execution or from the
 * latest run of an automation.
 */
public final class StatusEvent {

    private final Long testCaseId;
    private final EventSource source;
    private final ExecutionResult result;
    private final Instant effectiveTime;
    private final Instant tiebreakTime;
    private final Long recordId;

    public StatusEvent(Long testCaseId, EventSource source, ExecutionResult result,
                       Instant effectiveTime, Instant tiebreakTime, Long recordId) {
        if (source == EventSource.NONE) {
            throw new IllegalArgumentException("A status event needs a concrete source");
        }
        if (result == ExecutionResult.NOT_EXECUTED) {
            throw new IllegalArgumentException("NOT_EXECUTED is never recorded as an event");
        }
        this.testCaseId = Objects.requireNonNull(testCaseId, "testCaseId");
        this.source = Objects.requireNonNull(source, "source");
        this.result = Objects.requireNonNull(result, "result");
        this.effectiveTime = Objects.requireNonNull(effectiveTime, "effectiveTime");
        this.tiebreakTime = tiebreakTime == null ? effectiveTime : tiebreakTime;
        this.recordId = recordId == null ? 0L : recordId;
    }

    public static StatusEvent manual(Long testCaseId, ExecutionResult result, Instant executionDate,
                                     Instant createdAt, Long recordId) {
        return new StatusEvent(testCaseId, EventSource.MANUAL, result, executionDate, createdAt, recordId);
    }

    public static StatusEvent automated(Long testCaseId, ExecutionResult result, Instant lastRunDate, Long recordId) {
        return new StatusEvent(testCaseId, EventSource.AUTOMATED, result, lastRunDate, lastRunDate, recordId);
    }

    public Long getTestCaseId() {
        return testCaseId;
    }

    public EventSource getSource() {
        return source;
    }

    public ExecutionResult getResult() {
        return result;
    }

    public Instant getEffectiveTime() {
        return effectiveTime;
    }

    public Instant getTiebreakTime() {
        return tiebreakTime;
    }

    public Long getRecordId() {
        return recordId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StatusEvent)) {
            return false;
        }
        StatusEvent that = (StatusEvent) o;
        return testCaseId.equals(that.testCaseId)
                && source == that.source
                && result == that.result
                && effectiveTime.equals(that.effectiveTime)
                && tiebreakTime.equals(that.tiebreakTime)
                && recordId.equals(that.recordId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(testCaseId, source, result, effectiveTime, tiebreakTime, recordId);
    }

    @Override
    public String toString() {
        return "StatusEvent{" + source + " " + result + " tc=" + testCaseId + " at=" + effectiveTime
                + " tiebreak=" + tiebreakTime + " record=" + recordId + "}";
    }
}
