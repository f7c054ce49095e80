package com.qa.coverage.dto;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonInclude;

public class AggregateSnapshotDTO {

    private Instant cutoff;
    private Set<Long> selectedReleaseIds;
    private int passed;
    private int failed;
    private int blocked;
    private int notExecuted;
    private int total;
    private int executionRate;
    private int passRate;
    private RequirementCoverageDTO coverage;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Set<Long> unknownReleaseIds;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Map<String, Integer> diagnostics;

    public Instant getCutoff() {
        return cutoff;
    }

    public void setCutoff(Instant cutoff) {
        this.cutoff = cutoff;
    }

    public Set<Long> getSelectedReleaseIds() {
        return selectedReleaseIds;
    }

    public void setSelectedReleaseIds(Set<Long> selectedReleaseIds) {
        this.selectedReleaseIds = selectedReleaseIds;
    }

    public int getPassed() {
        return passed;
    }

    public void setPassed(int passed) {
        this.passed = passed;
    }

    public int getFailed() {
        return failed;
    }

    public void setFailed(int failed) {
        this.failed = failed;
    }

    public int getBlocked() {
        return blocked;
    }

    public void setBlocked(int blocked) {
        this.blocked = blocked;
    }

    public int getNotExecuted() {
        return notExecuted;
    }

    public void setNotExecuted(int notExecuted) {
        this.notExecuted = notExecuted;
    }

    public int getTotal() {
        return total;
    }

    public void setTotal(int total) {
        this.total = total;
    }

    public int getExecutionRate() {
        return executionRate;
    }

    public void setExecutionRate(int executionRate) {
        this.executionRate = executionRate;
    }

    public int getPassRate() {
        return passRate;
    }

    public void setPassRate(int passRate) {
        this.passRate = passRate;
    }

    public RequirementCoverageDTO getCoverage() {
        return coverage;
    }

    public void setCoverage(RequirementCoverageDTO coverage) {
        this.coverage = coverage;
    }

    public Set<Long> getUnknownReleaseIds() {
        return unknownReleaseIds;
    }

    public void setUnknownReleaseIds(Set<Long> unknownReleaseIds) {
        this.unknownReleaseIds = unknownReleaseIds;
    }

    public Map<String, Integer> getDiagnostics() {
        return diagnostics;
    }

    public void setDiagnostics(Map<String, Integer> diagnostics) {
        this.diagnostics = diagnostics;
    }
}
