package com.qa.coverage.engine;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Pre-sorted timelines for every test case that has events. Built once per request and shared by
 * the aggregator and every day of a trend.
 */
public final class StatusTimelines {

    private final Map<Long, StatusTimeline> byTestCase;

    private StatusTimelines(Map<Long, StatusTimeline> byTestCase) {
        this.byTestCase = byTestCase;
    }

    public static StatusTimelines build(Map<Long, List<StatusEvent>> eventsByTestCase, StatusResolver resolver) {
        Map<Long, StatusTimeline> timelines = new HashMap<>();
        if (eventsByTestCase != null) {
            eventsByTestCase.forEach((id, events) -> timelines.put(id, resolver.timeline(id, events)));
        }
        return new StatusTimelines(timelines);
    }

    public static StatusTimelines empty() {
        return new StatusTimelines(Collections.emptyMap());
    }

    public ResolvedStatus statusAt(Long testCaseId, Instant cutoff) {
        StatusTimeline timeline = byTestCase.get(testCaseId);
        if (timeline == null) {
            return ResolvedStatus.notExecuted(testCaseId, InvalidCutoffException.requireValid(cutoff));
        }
        return timeline.statusAt(cutoff);
    }
}
