package com.qa.coverage.engine;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * Picks the effective status of a test case as of a cutoff.
 *
 * <p>Events are totally ordered by effective time, then source (per {@link SourceTiePolicy}) when a
 * manual and an automated event coincide, then tiebreak time (record creation time of manual
 * executions), then source record id. The greatest event at or before the cutoff wins. This is the
 * only ordering used anywhere in the engine.
 */
public class StatusResolver {

    private final SourceTiePolicy tiePolicy;
    private final Comparator<StatusEvent> order;

    public StatusResolver(SourceTiePolicy tiePolicy) {
        this.tiePolicy = Objects.requireNonNull(tiePolicy, "tiePolicy");
        this.order = Comparator.comparing(StatusEvent::getEffectiveTime)
                .thenComparingInt((StatusEvent e) -> tiePolicy.rank(e.getSource()))
                .thenComparing(StatusEvent::getTiebreakTime)
                .thenComparing(StatusEvent::getRecordId)
                .thenComparing(StatusEvent::getResult);
    }

    public SourceTiePolicy getTiePolicy() {
        return tiePolicy;
    }

    /** Ascending total order; the last element of a sorted list is the winner. */
    public Comparator<StatusEvent> order() {
        return order;
    }

    public ResolvedStatus resolve(Collection<StatusEvent> events, Instant cutoff) {
        return resolve(null, events, cutoff);
    }

    public ResolvedStatus resolve(Long testCaseId, Collection<StatusEvent> events, Instant cutoff) {
        InvalidCutoffException.requireValid(cutoff);
        Optional<StatusEvent> winner = events == null ? Optional.empty()
                : events.stream()
                        .filter(e -> !e.getEffectiveTime().isAfter(cutoff))
                        .max(order);
        if (winner.isEmpty()) {
            return ResolvedStatus.notExecuted(testCaseId, cutoff);
        }
        return ResolvedStatus.of(winner.get(), cutoff);
    }

    public StatusTimeline timeline(Long testCaseId, Collection<StatusEvent> events) {
        return new StatusTimeline(testCaseId, events, order);
    }
}
