package com.qa.coverage.dto;

import java.time.Instant;

import lombok.Data;

@Data
public class ManualExecutionRequestDTO {

    private Long testCaseId;
    private Long releaseId;
    private String result;
    // defaults to the time of recording
    private Instant executionDate;
    private String executedBy;
    private String notes;
}
