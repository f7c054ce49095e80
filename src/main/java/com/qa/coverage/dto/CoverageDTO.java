package com.qa.coverage.dto;

import lombok.Data;

@Data
public class CoverageDTO {

    private int covered;
    private int notCovered;
    private int total;
    private int percentage;
}
