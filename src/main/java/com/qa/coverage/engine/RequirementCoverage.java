package com.qa.coverage.engine;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Requirement-level metrics at one cutoff. A requirement is covered when at least one in-scope test
 * case links to it, and fully tested when it has linked test cases and every one of them is PASSED.
 */
public final class RequirementCoverage {

    private final int requirementsTotal;
    private final int requirementsWithTests;
    private final int requirementsFullyTested;
    private final int testcasesLinked;
    private final int testcasesExecuted;
    private final Set<Long> fullyTestedRequirementIds;

    public RequirementCoverage(int requirementsTotal, int requirementsWithTests, int testcasesLinked,
                               int testcasesExecuted, Set<Long> fullyTestedRequirementIds) {
        this.requirementsTotal = requirementsTotal;
        this.requirementsWithTests = requirementsWithTests;
        this.requirementsFullyTested = fullyTestedRequirementIds.size();
        this.testcasesLinked = testcasesLinked;
        this.testcasesExecuted = testcasesExecuted;
        this.fullyTestedRequirementIds = Collections.unmodifiableSet(new LinkedHashSet<>(fullyTestedRequirementIds));
    }

    public int getRequirementsTotal() {
        return requirementsTotal;
    }

    public int getRequirementsWithTests() {
        return requirementsWithTests;
    }

    public int getRequirementsFullyTested() {
        return requirementsFullyTested;
    }

    public int getTestcasesLinked() {
        return testcasesLinked;
    }

    public int getTestcasesExecuted() {
        return testcasesExecuted;
    }

    public Set<Long> getFullyTestedRequirementIds() {
        return fullyTestedRequirementIds;
    }

    public int getCoveragePercentage() {
        return Percentages.of(requirementsWithTests, requirementsTotal);
    }

    public int getFullyTestedPercentage() {
        return Percentages.of(requirementsFullyTested, requirementsTotal);
    }
}
