package com.qa.coverage.service;

import java.util.List;

import com.qa.coverage.engine.AutomationRunRecord;
import com.qa.coverage.engine.ManualExecutionRecord;
import com.qa.coverage.engine.ReleaseRef;
import com.qa.coverage.engine.RequirementRef;
import com.qa.coverage.engine.TestCaseLinks;

/**
 * Everything one dashboard request needs, fetched once up front.
 */
public class ExecutionDataSet {

    private final List<TestCaseLinks> testCases;
    private final List<RequirementRef> requirements;
    private final List<ReleaseRef> releases;
    private final List<ManualExecutionRecord> manualExecutions;
    private final List<AutomationRunRecord> automationRuns;

    public ExecutionDataSet(List<TestCaseLinks> testCases, List<RequirementRef> requirements,
                            List<ReleaseRef> releases, List<ManualExecutionRecord> manualExecutions,
                            List<AutomationRunRecord> automationRuns) {
        this.testCases = testCases;
        this.requirements = requirements;
        this.releases = releases;
        this.manualExecutions = manualExecutions;
        this.automationRuns = automationRuns;
    }

    public List<TestCaseLinks> getTestCases() {
        return testCases;
    }

    public List<RequirementRef> getRequirements() {
        return requirements;
    }

    public List<ReleaseRef> getReleases() {
        return releases;
    }

    public List<ManualExecutionRecord> getManualExecutions() {
        return manualExecutions;
    }

    public List<AutomationRunRecord> getAutomationRuns() {
        return automationRuns;
    }
}
