package com.qa.coverage.engine;

import java.time.Instant;
import java.util.Optional;

/**
 * Raw manual execution as read from the execution log. Result and both timestamps may be missing;
 * the normalizer decides what that means.
 */
public final class ManualExecutionRecord {

    private final Long id;
    private final Long testCaseId;
    private final String result;
    private final Instant executionDate;
    private final Instant createdAt;

    public ManualExecutionRecord(Long id, Long testCaseId, String result, Instant executionDate, Instant createdAt) {
        this.id = id;
        this.testCaseId = testCaseId;
        this.result = result;
        this.executionDate = executionDate;
        this.createdAt = createdAt;
    }

    public Long getId() {
        return id;
    }

    public Long getTestCaseId() {
        return testCaseId;
    }

    public Optional<String> getResult() {
        return Optional.ofNullable(result);
    }

    public Optional<Instant> getExecutionDate() {
        return Optional.ofNullable(executionDate);
    }

    public Optional<Instant> getCreatedAt() {
        return Optional.ofNullable(createdAt);
    }
}
