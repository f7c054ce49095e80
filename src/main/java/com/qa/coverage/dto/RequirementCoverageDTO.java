package com.qa.coverage.dto;

import java.util.Set;

import lombok.Data;

@Data
public class RequirementCoverageDTO {

    private int requirementsTotal;
    private int requirementsWithTests;
    private int requirementsFullyTested;
    private int testcasesLinked;
    private int testcasesExecuted;
    private int coveragePercentage;
    private int fullyTestedPercentage;
    private Set<Long> fullyTestedRequirementIds;
}
