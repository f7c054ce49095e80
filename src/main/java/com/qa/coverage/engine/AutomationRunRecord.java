package com.qa.coverage.engine;

import java.time.Instant;
import java.util.Optional;

/**
 * The latest run of one automation. The automation directory keeps no run history, so this is all
 * there is for automated results.
 */
public final class AutomationRunRecord {

    private final Long automationId;
    private final Long testCaseId;
    private final String lastRunResult;
    private final Instant lastRunDate;

    public AutomationRunRecord(Long automationId, Long testCaseId, String lastRunResult, Instant lastRunDate) {
        this.automationId = automationId;
        this.testCaseId = testCaseId;
        this.lastRunResult = lastRunResult;
        this.lastRunDate = lastRunDate;
    }

    public Long getAutomationId() {
        return automationId;
    }

    public Long getTestCaseId() {
        return testCaseId;
    }

    public Optional<String> getLastRunResult() {
        return Optional.ofNullable(lastRunResult);
    }

    public Optional<Instant> getLastRunDate() {
        return Optional.ofNullable(lastRunDate);
    }
}
