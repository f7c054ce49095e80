package com.qa.coverage.engine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Events of one test case sorted once, answering "status as of" queries with a binary search.
 * Gives the same answer as {@link StatusResolver#resolve(Long, Collection, Instant)}.
 */
public final class StatusTimeline {

    private final Long testCaseId;
    private final List<StatusEvent> sorted;

    StatusTimeline(Long testCaseId, Collection<StatusEvent> events, Comparator<StatusEvent> order) {
        this.testCaseId = testCaseId;
        this.sorted = events == null ? new ArrayList<>() : new ArrayList<>(events);
        this.sorted.sort(order);
    }

    public Long getTestCaseId() {
        return testCaseId;
    }

    public int size() {
        return sorted.size();
    }

    public ResolvedStatus statusAt(Instant cutoff) {
        InvalidCutoffException.requireValid(cutoff);
        int idx = lastIndexAtOrBefore(cutoff);
        if (idx < 0) {
            return ResolvedStatus.notExecuted(testCaseId, cutoff);
        }
        return ResolvedStatus.of(sorted.get(idx), cutoff);
    }

    // effective time is the primary sort key, so everything at or before the cutoff is a prefix
    private int lastIndexAtOrBefore(Instant cutoff) {
        int lo = 0;
        int hi = sorted.size() - 1;
        int found = -1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted.get(mid).getEffectiveTime().isAfter(cutoff)) {
                hi = mid - 1;
            } else {
                found = mid;
                lo = mid + 1;
            }
        }
        return found;
    }
}
