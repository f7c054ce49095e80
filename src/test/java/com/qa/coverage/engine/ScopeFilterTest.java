package com.qa.coverage.engine;

import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ScopeFilterTest {

    private ScopeFilter scopeFilter;
    private List<TestCaseLinks> testCases;
    private List<RequirementRef> requirements;
    private List<ReleaseRef> releases;

    @Before
    public void setUp() {
        scopeFilter = new ScopeFilter();
        requirements = Arrays.asList(
                new RequirementRef(100L, 1L),
                new RequirementRef(101L, 2L),
                new RequirementRef(102L, null));
        testCases = Arrays.asList(
                // tagged with release 1 only
                new TestCaseLinks(10L, ids(), ids(1L)),
                // reaches release 1 through requirement 100 only
                new TestCaseLinks(11L, ids(100L), ids()),
                new TestCaseLinks(12L, ids(101L), ids(2L)),
                new TestCaseLinks(13L, ids(102L), ids()));
        releases = Arrays.asList(new ReleaseRef(1L), new ReleaseRef(2L), new ReleaseRef(3L));
    }

    @Test
    public void emptySelectionMeansEverything() {
        Scope scope = scopeFilter.scope(Collections.emptySet(), testCases, requirements, releases);

        assertTrue(scope.isUnrestricted());
        assertEquals(ids(100L, 101L, 102L), scope.getRequirementIds());
        assertEquals(ids(10L, 11L, 12L, 13L), scope.getTestCaseIds());
        assertEquals("*", scope.signature());
    }

    @Test
    public void testCaseInScopeViaTagOrViaRequirement() {
        Scope scope = scopeFilter.scope(ids(1L), testCases, requirements, releases);

        assertFalse(scope.isUnrestricted());
        assertEquals(ids(100L), scope.getRequirementIds());
        assertEquals(ids(10L, 11L), scope.getTestCaseIds());
        assertTrue(scope.getUnknownReleaseIds().isEmpty());
    }

    @Test
    public void requirementOfAnotherReleaseStaysOut() {
        List<RequirementRef> reqs = Collections.singletonList(new RequirementRef(100L, 2L));
        List<TestCaseLinks> tcs = Collections.singletonList(new TestCaseLinks(1L, ids(100L), ids()));

        Scope scope = scopeFilter.scope(ids(1L), tcs, reqs, releases);

        assertTrue(scope.getRequirementIds().isEmpty());
        assertTrue(scope.getTestCaseIds().isEmpty());
    }

    @Test
    public void knownReleaseWithNothingLinkedIsEmptyNotUnknown() {
        Scope scope = scopeFilter.scope(ids(3L), testCases, requirements, releases);

        assertTrue(scope.getRequirementIds().isEmpty());
        assertTrue(scope.getTestCaseIds().isEmpty());
        assertTrue(scope.getUnknownReleaseIds().isEmpty());
    }

    @Test
    public void multipleReleasesUnion() {
        Scope scope = scopeFilter.scope(ids(2L, 1L), testCases, requirements, releases);

        assertEquals(ids(100L, 101L), scope.getRequirementIds());
        assertEquals(ids(10L, 11L, 12L), scope.getTestCaseIds());
        assertEquals("1,2", scope.signature());
    }

    @Test
    public void unknownReleaseIdsAreReportedNotRejected() {
        Scope scope = scopeFilter.scope(ids(1L, 99L), testCases, requirements, releases);

        assertEquals(ids(99L), scope.getUnknownReleaseIds());
        assertEquals(ids(10L, 11L), scope.getTestCaseIds());

        Scope onlyUnknown = scopeFilter.scope(ids(99L), testCases, requirements, releases);
        assertFalse(onlyUnknown.isUnrestricted());
        assertTrue(onlyUnknown.getTestCaseIds().isEmpty());
        assertTrue(onlyUnknown.getRequirementIds().isEmpty());
    }

    @Test
    public void releaseKnownOnlyFromLinksIsNotUnknown() {
        List<TestCaseLinks> tagged = Collections.singletonList(new TestCaseLinks(20L, ids(), ids(7L)));
        Scope scope = scopeFilter.scope(ids(7L), tagged, requirements, releases);

        assertTrue(scope.getUnknownReleaseIds().isEmpty());
        assertEquals(ids(20L), scope.getTestCaseIds());
    }

    @Test
    public void nullCollectionsAreTreatedAsEmpty() {
        Scope scope = scopeFilter.scope(null, null, null, null);

        assertTrue(scope.isUnrestricted());
        assertTrue(scope.getTestCaseIds().isEmpty());
    }

    private static Set<Long> ids(Long... ids) {
        return new HashSet<>(Arrays.asList(ids));
    }
}
