package com.qa.coverage.engine;

/**
 * Counters for records the normalizer could not use as-is. Malformed records are dropped,
 * degraded ones are kept with a documented fallback.
 */
public class NormalizationDiagnostics {

    private int malformedManual;
    private int malformedAutomated;
    private int degradedManual;
    private int automationsWithoutRun;

    void manualMalformed() {
        malformedManual++;
    }

    void automatedMalformed() {
        malformedAutomated++;
    }

    void manualDegraded() {
        degradedManual++;
    }

    void automationNeverRun() {
        automationsWithoutRun++;
    }

    public int getMalformedManual() {
        return malformedManual;
    }

    public int getMalformedAutomated() {
        return malformedAutomated;
    }

    public int getMalformedTotal() {
        return malformedManual + malformedAutomated;
    }

    public int getDegradedManual() {
        return degradedManual;
    }

    public int getAutomationsWithoutRun() {
        return automationsWithoutRun;
    }

    @Override
    public String toString() {
        return "malformedManual=" + malformedManual + ", malformedAutomated=" + malformedAutomated
                + ", degradedManual=" + degradedManual + ", automationsWithoutRun=" + automationsWithoutRun;
    }
}
