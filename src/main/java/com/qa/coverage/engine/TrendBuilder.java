package com.qa.coverage.engine;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays the status of a scope once per calendar day over a 7, 14 or 30 day window, oldest day
 * first. Every day's cutoff is the last millisecond of that day in one fixed reference zone.
 *
 * <p>Automated results only have their latest run, so an automated status can only show up from the
 * day of that run onwards; earlier automated runs are not visible to the replay.
 */
public class TrendBuilder {

    private static final Logger logger = LoggerFactory.getLogger(TrendBuilder.class);

    public static final Set<Integer> ALLOWED_WINDOWS =
            Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(7, 14, 30)));

    private final Aggregator aggregator;
    private final ZoneId referenceZone;

    public TrendBuilder(Aggregator aggregator, ZoneId referenceZone) {
        this.aggregator = aggregator;
        this.referenceZone = referenceZone;
    }

    public ZoneId getReferenceZone() {
        return referenceZone;
    }

    public static int requireValidWindow(int windowDays) {
        if (!ALLOWED_WINDOWS.contains(windowDays)) {
            throw new InvalidTrendWindowException(windowDays);
        }
        return windowDays;
    }

    public List<AggregateSnapshot> buildTrend(int windowDays, Scope scope,
                                              Map<Long, List<StatusEvent>> eventsByTestCase, Instant now) {
        requireValidWindow(windowDays);
        return buildTrend(windowDays, scope, StatusTimelines.build(eventsByTestCase, aggregator.getResolver()), now);
    }

    public List<AggregateSnapshot> buildTrend(int windowDays, Scope scope, StatusTimelines timelines, Instant now) {
        requireValidWindow(windowDays);
        InvalidCutoffException.requireValid(now);

        LocalDate today = now.atZone(referenceZone).toLocalDate();
        List<AggregateSnapshot> days = new ArrayList<>(windowDays);
        for (int offset = windowDays - 1; offset >= 0; offset--) {
            LocalDate day = today.minusDays(offset);
            AggregateSnapshot snapshot = aggregator.countStatuses(scope, endOfDay(day), timelines);
            logger.debug("Trend {} -> passed={}, failed={}, blocked={}, notExecuted={}", day,
                    snapshot.getPassed(), snapshot.getFailed(), snapshot.getBlocked(), snapshot.getNotExecuted());
            days.add(snapshot);
        }
        return days;
    }

    /** 23:59:59.999 of the given day in the reference zone. */
    public Instant endOfDay(LocalDate day) {
        return day.plusDays(1).atStartOfDay(referenceZone).toInstant().minusMillis(1);
    }

    public LocalDate dayOf(Instant cutoff) {
        return cutoff.atZone(referenceZone).toLocalDate();
    }
}
