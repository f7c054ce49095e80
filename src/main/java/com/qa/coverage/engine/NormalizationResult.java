package com.qa.coverage.engine;

import java.util.Collections;
import java.util.List;
import java.util.Map;

public final class NormalizationResult {

    private final Map<Long, List<StatusEvent>> eventsByTestCase;
    private final NormalizationDiagnostics diagnostics;

    NormalizationResult(Map<Long, List<StatusEvent>> eventsByTestCase, NormalizationDiagnostics diagnostics) {
        this.eventsByTestCase = Collections.unmodifiableMap(eventsByTestCase);
        this.diagnostics = diagnostics;
    }

    /** Events per test case, in input order (unsorted). */
    public Map<Long, List<StatusEvent>> getEventsByTestCase() {
        return eventsByTestCase;
    }

    public List<StatusEvent> eventsFor(Long testCaseId) {
        return eventsByTestCase.getOrDefault(testCaseId, Collections.emptyList());
    }

    public NormalizationDiagnostics getDiagnostics() {
        return diagnostics;
    }
}
