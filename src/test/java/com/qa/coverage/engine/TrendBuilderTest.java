package com.qa.coverage.engine;

import org.junit.Before;
import org.junit.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class TrendBuilderTest {

    private static final Instant NOW = Instant.parse("2024-05-10T15:30:00Z");

    private TrendBuilder trendBuilder;
    private Scope scope;
    private List<TestCaseLinks> testCases;

    @Before
    public void setUp() {
        Aggregator aggregator = new Aggregator(new StatusResolver(SourceTiePolicy.MANUAL_WINS));
        trendBuilder = new TrendBuilder(aggregator, ZoneOffset.UTC);
        testCases = Arrays.asList(
                new TestCaseLinks(1L, Collections.emptySet(), Collections.emptySet()),
                new TestCaseLinks(2L, Collections.emptySet(), Collections.emptySet()));
        scope = new ScopeFilter().scope(Collections.emptySet(), testCases, Collections.emptyList(),
                Collections.emptyList());
    }

    @Test
    public void trendHasOnePointPerDayOldestFirst() {
        for (int window : Arrays.asList(7, 14, 30)) {
            List<AggregateSnapshot> trend = trendBuilder.buildTrend(window, scope, Collections.emptyMap(), NOW);

            assertEquals(window, trend.size());
            assertEquals(LocalDate.of(2024, 5, 10), trendBuilder.dayOf(trend.get(window - 1).getCutoff()));
            assertEquals(LocalDate.of(2024, 5, 10).minusDays(window - 1), trendBuilder.dayOf(trend.get(0).getCutoff()));
            for (int i = 1; i < trend.size(); i++) {
                assertEquals(trend.get(i - 1).getCutoff().plusSeconds(86400), trend.get(i).getCutoff());
            }
        }
    }

    @Test
    public void dayCutoffIsLastMillisecondOfTheDay() {
        List<AggregateSnapshot> trend = trendBuilder.buildTrend(7, scope, Collections.emptyMap(), NOW);

        assertEquals(Instant.parse("2024-05-10T23:59:59.999Z"), trend.get(6).getCutoff());
        assertEquals(Instant.parse("2024-05-04T23:59:59.999Z"), trend.get(0).getCutoff());
    }

    @Test
    public void noEventsMeansEveryDayNotExecuted() {
        List<AggregateSnapshot> trend = trendBuilder.buildTrend(14, scope, Collections.emptyMap(), NOW);

        for (AggregateSnapshot day : trend) {
            assertEquals(0, day.getPassed() + day.getFailed() + day.getBlocked());
            assertEquals(2, day.getNotExecuted());
        }
    }

    @Test
    public void eachDayReflectsEventsUpToItsEnd() {
        Map<Long, List<StatusEvent>> events = new HashMap<>();
        events.put(1L, Arrays.asList(
                StatusEvent.manual(1L, ExecutionResult.FAILED, Instant.parse("2024-05-05T08:00:00Z"), null, 1L),
                StatusEvent.manual(1L, ExecutionResult.PASSED, Instant.parse("2024-05-08T23:59:59.999Z"), null, 2L)));
        events.put(2L, Collections.singletonList(
                StatusEvent.automated(2L, ExecutionResult.BLOCKED, Instant.parse("2024-05-09T00:00:00Z"), 3L)));

        List<AggregateSnapshot> trend = trendBuilder.buildTrend(7, scope, events, NOW);

        // May 4
        assertEquals(2, trend.get(0).getNotExecuted());
        // May 5 to May 7
        for (int i = 1; i <= 3; i++) {
            assertEquals(1, trend.get(i).getFailed());
            assertEquals(1, trend.get(i).getNotExecuted());
        }
        // May 8: the pass lands on the last millisecond
        assertEquals(1, trend.get(4).getPassed());
        assertEquals(0, trend.get(4).getBlocked());
        // May 9 and 10
        assertEquals(1, trend.get(5).getBlocked());
        assertEquals(1, trend.get(6).getPassed());
        assertEquals(0, trend.get(6).getNotExecuted());
    }

    @Test
    public void trendPointsMatchIndependentSnapshots() {
        Map<Long, List<StatusEvent>> events = new HashMap<>();
        events.put(1L, Collections.singletonList(
                StatusEvent.manual(1L, ExecutionResult.PASSED, Instant.parse("2024-05-06T12:00:00Z"), null, 1L)));
        Aggregator aggregator = new Aggregator(new StatusResolver(SourceTiePolicy.MANUAL_WINS));

        List<AggregateSnapshot> trend = trendBuilder.buildTrend(7, scope, events, NOW);
        for (AggregateSnapshot day : trend) {
            AggregateSnapshot direct = aggregator.aggregate(scope, day.getCutoff(), events, testCases);
            assertEquals(direct.getPassed(), day.getPassed());
            assertEquals(direct.getNotExecuted(), day.getNotExecuted());
        }
    }

    @Test
    public void dayBoundariesFollowReferenceZone() {
        ZoneId newYork = ZoneId.of("America/New_York");
        TrendBuilder zoned = new TrendBuilder(new Aggregator(new StatusResolver(SourceTiePolicy.MANUAL_WINS)), newYork);
        Map<Long, List<StatusEvent>> events = new HashMap<>();
        // 02:00 UTC on May 10 is still May 9 in New York
        events.put(1L, Collections.singletonList(
                StatusEvent.manual(1L, ExecutionResult.PASSED, Instant.parse("2024-05-10T02:00:00Z"), null, 1L)));

        List<AggregateSnapshot> trend = zoned.buildTrend(7, scope, events, NOW);

        assertEquals(Instant.parse("2024-05-11T03:59:59.999Z"), trend.get(6).getCutoff());
        assertEquals(1, trend.get(5).getPassed());
        assertEquals(0, trend.get(4).getPassed());
    }

    @Test
    public void rejectsUnsupportedWindows() {
        for (int window : new HashSet<>(Arrays.asList(0, 1, 8, 31, -7))) {
            try {
                trendBuilder.buildTrend(window, scope, Collections.emptyMap(), NOW);
                fail("window " + window + " accepted");
            } catch (InvalidTrendWindowException e) {
                assertEquals("InvalidTrendWindow", e.getErrorType());
            }
        }
    }
}
