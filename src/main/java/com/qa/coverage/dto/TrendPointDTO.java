package com.qa.coverage.dto;

import java.time.Instant;
import java.time.LocalDate;

import lombok.Data;

@Data
public class TrendPointDTO {

    private LocalDate date;
    // chart axis label, e.g. "May 01"
    private String label;
    private Instant cutoff;
    private int passed;
    private int failed;
    private int blocked;
    private int notExecuted;
    private int total;
}
