package com.qa.coverage.model;

import java.time.LocalDateTime;

import javax.persistence.Column;
import javax.persistence.Entity;
import javax.persistence.GeneratedValue;
import javax.persistence.GenerationType;
import javax.persistence.Id;
import javax.persistence.Table;

/**
 * An automation script bound to a test case. Only the latest run is kept.
 */
@Entity
@Table(name = "automations")
public class Automation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long idAutomation;

    @Column(name = "test_case_id")
    private Long testCaseId;

    @Column(name = "release_id")
    private Long releaseId;

    private String name;

    // passed | failed | skipped | blocked | error, null until first run
    @Column(name = "last_run_result")
    private String lastRunResult;

    @Column(name = "last_run_date")
    private LocalDateTime lastRunDate;

    private LocalDateTime modifiedOn;

    public Long getIdAutomation() {
        return idAutomation;
    }

    public void setIdAutomation(Long idAutomation) {
        this.idAutomation = idAutomation;
    }

    public Long getTestCaseId() {
        return testCaseId;
    }

    public void setTestCaseId(Long testCaseId) {
        this.testCaseId = testCaseId;
    }

    public Long getReleaseId() {
        return releaseId;
    }

    public void setReleaseId(Long releaseId) {
        this.releaseId = releaseId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getLastRunResult() {
        return lastRunResult;
    }

    public void setLastRunResult(String lastRunResult) {
        this.lastRunResult = lastRunResult;
    }

    public LocalDateTime getLastRunDate() {
        return lastRunDate;
    }

    public void setLastRunDate(LocalDateTime lastRunDate) {
        this.lastRunDate = lastRunDate;
    }

    public LocalDateTime getModifiedOn() {
        return modifiedOn;
    }

    public void setModifiedOn(LocalDateTime modifiedOn) {
        this.modifiedOn = modifiedOn;
    }
}
