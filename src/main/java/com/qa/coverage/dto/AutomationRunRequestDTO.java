package com.qa.coverage.dto;

import java.time.Instant;

import lombok.Data;

@Data
public class AutomationRunRequestDTO {

    private String result;
    private Instant runDate;
}
