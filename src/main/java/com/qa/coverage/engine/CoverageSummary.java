package com.qa.coverage.engine;

public final class CoverageSummary {

    private final int covered;
    private final int notCovered;
    private final int total;

    public CoverageSummary(int covered, int total) {
        this.covered = covered;
        this.notCovered = total - covered;
        this.total = total;
    }

    public int getCovered() {
        return covered;
    }

    public int getNotCovered() {
        return notCovered;
    }

    public int getTotal() {
        return total;
    }

    public int getPercentage() {
        return Percentages.of(covered, total);
    }
}
