package com.qa.coverage.engine;

import java.time.Instant;
import java.util.Optional;

/**
 * Status counts over a scope at one cutoff. Coverage is only attached to the "current" snapshot,
 * trend days carry counts alone.
 */
public final class AggregateSnapshot {

    private final Instant cutoff;
    private final int passed;
    private final int failed;
    private final int blocked;
    private final int notExecuted;
    private final RequirementCoverage coverage;

    public AggregateSnapshot(Instant cutoff, int passed, int failed, int blocked, int notExecuted,
                             RequirementCoverage coverage) {
        this.cutoff = cutoff;
        this.passed = passed;
        this.failed = failed;
        this.blocked = blocked;
        this.notExecuted = notExecuted;
        this.coverage = coverage;
    }

    public Instant getCutoff() {
        return cutoff;
    }

    public int getPassed() {
        return passed;
    }

    public int getFailed() {
        return failed;
    }

    public int getBlocked() {
        return blocked;
    }

    public int getNotExecuted() {
        return notExecuted;
    }

    public int getTotal() {
        return passed + failed + blocked + notExecuted;
    }

    public int getExecutionRate() {
        return Percentages.of(passed + failed + blocked, getTotal());
    }

    public int getPassRate() {
        return Percentages.of(passed, getTotal());
    }

    public Optional<RequirementCoverage> getCoverage() {
        return Optional.ofNullable(coverage);
    }

    @Override
    public String toString() {
        return "AggregateSnapshot{cutoff=" + cutoff + ", passed=" + passed + ", failed=" + failed
                + ", blocked=" + blocked + ", notExecuted=" + notExecuted + "}";
    }
}
